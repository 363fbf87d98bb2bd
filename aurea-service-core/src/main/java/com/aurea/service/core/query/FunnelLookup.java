package com.aurea.service.core.query;

import com.aurea.service.core.api.FunnelNotFoundException;
import com.aurea.service.core.model.Funnel;
import com.aurea.service.core.repo.FunnelRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.UUID;
import org.springframework.stereotype.Service;

/** Every analysis starts here: an unknown funnel fails the whole request. */
@Service
public class FunnelLookup {
    private static final int CACHE_SIZE = 10_000;
    private static final Duration CACHE_TTL = Duration.ofMinutes(5);

    private final FunnelRepository funnelRepository;

    // Only found funnels are cached; a miss always goes back to the store.
    private final Cache<UUID, Funnel> known = Caffeine.newBuilder()
            .maximumSize(CACHE_SIZE)
            .expireAfterWrite(CACHE_TTL)
            .build();

    public FunnelLookup(FunnelRepository funnelRepository) {
        this.funnelRepository = funnelRepository;
    }

    public Funnel requireFunnel(UUID funnelId) {
        Funnel cached = known.getIfPresent(funnelId);
        if (cached != null) {
            return cached;
        }
        Funnel funnel =
                funnelRepository.findById(funnelId).orElseThrow(() -> new FunnelNotFoundException(funnelId));
        known.put(funnelId, funnel);
        return funnel;
    }
}
