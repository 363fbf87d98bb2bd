package com.aurea.service.core.repo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Splits bind lists for {@code in (:ids)} predicates so a statement stays well under the driver's parameter limit. */
final class InClauseChunks {
    static final int MAX_BIND_VALUES = 1000;

    private InClauseChunks() {}

    static <T> List<List<T>> partition(Collection<T> values, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        List<T> all = new ArrayList<>(values);
        List<List<T>> chunks = new ArrayList<>();
        int total = all.size();
        for (int i = 0; i < total; i += chunkSize) {
            int toIndex = Math.min(i + chunkSize, total);
            chunks.add(new ArrayList<>(all.subList(i, toIndex)));
        }
        return chunks;
    }

    static <T> List<List<T>> partition(Collection<T> values) {
        return partition(values, MAX_BIND_VALUES);
    }
}
