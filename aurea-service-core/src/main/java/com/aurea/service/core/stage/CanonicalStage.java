package com.aurea.service.core.stage;

import java.util.Locale;

/** Fixed funnel stage order; stages outside this list sort after {@link #ABANDONED}. */
public enum CanonicalStage {
    AWARENESS("awareness"),
    INTEREST("interest"),
    DESIRE("desire"),
    CHECKOUT("checkout"),
    PURCHASE("purchase"),
    ABANDONED("abandoned");

    public static final int UNRECOGNIZED_RANK = 7;

    private final String wireValue;

    CanonicalStage(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /** 1-based rank in the canonical order. */
    public int rank() {
        return ordinal() + 1;
    }

    public static CanonicalStage fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CanonicalStage stage : values()) {
            if (stage.wireValue.equals(normalized)) {
                return stage;
            }
        }
        return null;
    }

    public static int rankOf(String value) {
        CanonicalStage stage = fromValue(value);
        return stage == null ? UNRECOGNIZED_RANK : stage.rank();
    }
}
