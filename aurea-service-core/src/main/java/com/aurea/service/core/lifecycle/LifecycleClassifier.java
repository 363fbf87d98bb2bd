package com.aurea.service.core.lifecycle;

import com.aurea.service.core.model.LifecycleStage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Deterministic visitor lifecycle rule. Recency is checked before frequency: a visitor unseen for 30 days is
 * {@link LifecycleStage#CHURNED} regardless of session count.
 */
@Component
public class LifecycleClassifier {

    static final Duration CHURN_AFTER = Duration.ofDays(30);
    static final int LOYAL_SESSIONS = 5;
    static final int RETURNING_SESSIONS = 2;

    private final Clock clock;

    public LifecycleClassifier(Clock clock) {
        this.clock = clock;
    }

    public LifecycleStage classify(int totalSessions, Instant lastSeen) {
        if (lastSeen != null && Duration.between(lastSeen, clock.instant()).compareTo(CHURN_AFTER) >= 0) {
            return LifecycleStage.CHURNED;
        }
        if (totalSessions >= LOYAL_SESSIONS) {
            return LifecycleStage.LOYAL;
        }
        if (totalSessions >= RETURNING_SESSIONS) {
            return LifecycleStage.RETURNING;
        }
        return LifecycleStage.NEW;
    }
}
