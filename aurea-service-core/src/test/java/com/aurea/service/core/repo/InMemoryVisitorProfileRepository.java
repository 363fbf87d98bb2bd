package com.aurea.service.core.repo;

import com.aurea.service.core.model.LifecycleStage;
import com.aurea.service.core.model.VisitorProfile;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Profiles keyed by id, with funnel membership recorded explicitly instead of derived from sessions. Synchronized so
 * concurrent backfills see the same conditional-write behaviour as the store.
 */
public class InMemoryVisitorProfileRepository extends VisitorProfileRepository {
    private static final Comparator<VisitorProfile> PAGE_ORDER = Comparator.comparing(
                    (VisitorProfile p) -> p.lastSeen() == null ? Instant.EPOCH : p.lastSeen())
            .thenComparing(VisitorProfile::id)
            .reversed();

    private final Map<String, VisitorProfile> profiles = new LinkedHashMap<>();
    private final Map<UUID, Set<String>> membership = new HashMap<>();
    private int updateCalls;

    public InMemoryVisitorProfileRepository() {
        super(null);
    }

    public synchronized void add(UUID funnelId, VisitorProfile profile) {
        profiles.put(profile.id(), profile);
        membership.computeIfAbsent(funnelId, k -> new LinkedHashSet<>()).add(profile.id());
    }

    public synchronized VisitorProfile get(String id) {
        return profiles.get(id);
    }

    public synchronized int updateCalls() {
        return updateCalls;
    }

    @Override
    public synchronized List<VisitorProfile> findUnclassifiedForFunnel(UUID funnelId) {
        return inFunnel(funnelId).stream().filter(p -> p.lifecycleStage() == null).toList();
    }

    @Override
    public synchronized int updateLifecycleStages(Map<String, LifecycleStage> stages) {
        updateCalls++;
        int written = 0;
        for (Map.Entry<String, LifecycleStage> entry : stages.entrySet()) {
            VisitorProfile current = profiles.get(entry.getKey());
            if (current != null && current.lifecycleStage() == null) {
                profiles.put(current.id(), current.withLifecycleStage(entry.getValue()));
                written++;
            }
        }
        return written;
    }

    @Override
    public synchronized List<VisitorProfile> findPage(UUID funnelId, VisitorProfileFilter filter, String cursor, int limit) {
        List<VisitorProfile> ordered = inFunnel(funnelId).stream()
                .filter(filter::matches)
                .sorted(PAGE_ORDER)
                .toList();
        int start = 0;
        if (cursor != null) {
            VisitorProfile anchor = profiles.get(cursor);
            while (start < ordered.size() && PAGE_ORDER.compare(ordered.get(start), anchor) <= 0) {
                start++;
            }
        }
        return ordered.subList(start, Math.min(ordered.size(), start + limit));
    }

    @Override
    public synchronized Optional<VisitorProfile> findById(UUID funnelId, String id) {
        if (!membership.getOrDefault(funnelId, Set.of()).contains(id)) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(id));
    }

    private List<VisitorProfile> inFunnel(UUID funnelId) {
        List<VisitorProfile> out = new ArrayList<>();
        for (String id : membership.getOrDefault(funnelId, Set.of())) {
            out.add(profiles.get(id));
        }
        return out;
    }
}
