package com.aurea.service.core.lifecycle;

import com.aurea.service.core.model.LifecycleStage;
import com.aurea.service.core.model.VisitorProfile;
import com.aurea.service.core.repo.VisitorProfileRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Lazily classifies visitor profiles of a funnel whose lifecycle stage was never set. Safe to run concurrently: rows
 * classified by another caller in the meantime are skipped by the store.
 */
@Service
public class VisitorLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(VisitorLifecycleService.class);

    private final VisitorProfileRepository profileRepository;
    private final LifecycleClassifier classifier;

    public VisitorLifecycleService(VisitorProfileRepository profileRepository, LifecycleClassifier classifier) {
        this.profileRepository = profileRepository;
        this.classifier = classifier;
    }

    /** @return number of profiles written by this call */
    @Transactional
    public int backfill(UUID funnelId) {
        List<VisitorProfile> unclassified = profileRepository.findUnclassifiedForFunnel(funnelId);
        if (unclassified.isEmpty()) {
            return 0;
        }
        Map<String, LifecycleStage> stages = new LinkedHashMap<>();
        for (VisitorProfile profile : unclassified) {
            stages.put(profile.id(), classifier.classify(profile.totalSessions(), profile.lastSeen()));
        }
        int written = profileRepository.updateLifecycleStages(stages);
        log.info("Lifecycle backfill funnel={} candidates={} written={}", funnelId, stages.size(), written);
        return written;
    }
}
