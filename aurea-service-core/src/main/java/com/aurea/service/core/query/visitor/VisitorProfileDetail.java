package com.aurea.service.core.query.visitor;

import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.model.VisitorProfile;
import java.util.List;

/**
 * @param sessions the visitor's sessions in the funnel, newest first
 * @param avgEngagementRate mean over all sessions, missing rates counted as zero
 * @param avgExperienceScore mean over all sessions, missing scores counted as zero
 */
public record VisitorProfileDetail(
        VisitorProfile profile,
        List<FunnelSession> sessions,
        long totalSessions,
        long totalConversions,
        double totalRevenue,
        double avgEngagementRate,
        double avgExperienceScore) {}
