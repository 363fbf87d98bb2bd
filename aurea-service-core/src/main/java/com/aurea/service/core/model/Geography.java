package com.aurea.service.core.model;

public record Geography(String countryCode, String countryName, String region, String city) {

    public static final String UNKNOWN = "Unknown";

    public static Geography unknown() {
        return new Geography(null, null, null, null);
    }

    /** True when the value is present and not the {@code Unknown} sentinel. */
    public static boolean isKnown(String value) {
        return value != null && !value.isBlank() && !UNKNOWN.equals(value);
    }

    /** Country code and name are both absent or the sentinel. */
    public boolean countryUnknown() {
        return !isKnown(countryCode) && !isKnown(countryName);
    }

    public boolean hasAnyField() {
        return countryCode != null || countryName != null || region != null || city != null;
    }
}
