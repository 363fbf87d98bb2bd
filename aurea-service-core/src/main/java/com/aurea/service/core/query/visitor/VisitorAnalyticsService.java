package com.aurea.service.core.query.visitor;

import com.aurea.service.core.api.VisitorNotFoundException;
import com.aurea.service.core.lifecycle.VisitorLifecycleService;
import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.model.VisitorProfile;
import com.aurea.service.core.query.FunnelLookup;
import com.aurea.service.core.repo.SessionRepository;
import com.aurea.service.core.repo.VisitorProfileFilter;
import com.aurea.service.core.repo.VisitorProfileRepository;
import com.aurea.service.core.support.Percentages;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;

@Service
public class VisitorAnalyticsService {

    private final FunnelLookup funnelLookup;
    private final VisitorProfileRepository profileRepository;
    private final SessionRepository sessionRepository;
    private final VisitorLifecycleService lifecycleService;

    public VisitorAnalyticsService(
            FunnelLookup funnelLookup,
            VisitorProfileRepository profileRepository,
            SessionRepository sessionRepository,
            VisitorLifecycleService lifecycleService) {
        this.funnelLookup = funnelLookup;
        this.profileRepository = profileRepository;
        this.sessionRepository = sessionRepository;
        this.lifecycleService = lifecycleService;
    }

    /**
     * One page of the funnel's visitors, most recently seen first. Unclassified profiles are classified before the
     * page is read so the stage filter sees them.
     */
    public VisitorProfilesPage profiles(UUID funnelId, VisitorProfileFilter filter, String cursor, int limit) {
        funnelLookup.requireFunnel(funnelId);
        lifecycleService.backfill(funnelId);

        List<VisitorProfile> fetched = profileRepository.findPage(
                funnelId, filter == null ? VisitorProfileFilter.none() : filter, cursor, limit + 1);
        boolean hasMore = fetched.size() > limit;
        List<VisitorProfile> page = hasMore ? fetched.subList(0, limit) : fetched;

        Map<String, FunnelSession> latest = page.isEmpty()
                ? Map.of()
                : sessionRepository.findLatestForVisitors(
                        funnelId, page.stream().map(VisitorProfile::id).toList());
        List<VisitorProfilesPage.Item> items = new ArrayList<>(page.size());
        for (VisitorProfile profile : page) {
            items.add(new VisitorProfilesPage.Item(profile, lastSession(latest.get(profile.id()))));
        }
        String nextCursor = hasMore ? page.get(page.size() - 1).id() : null;
        return new VisitorProfilesPage(List.copyOf(items), nextCursor);
    }

    /** A visitor of this funnel with their sessions. The profile is classified first when its stage is unset. */
    public VisitorProfileDetail profile(UUID funnelId, String visitorId) {
        funnelLookup.requireFunnel(funnelId);
        lifecycleService.backfill(funnelId);
        VisitorProfile profile = profileRepository
                .findById(funnelId, visitorId)
                .orElseThrow(() -> new VisitorNotFoundException(visitorId));
        List<FunnelSession> sessions = sessionRepository.findForVisitor(funnelId, visitorId);

        long conversions = 0;
        double revenue = 0.0d;
        double engagement = 0.0d;
        double experience = 0.0d;
        for (FunnelSession session : sessions) {
            if (session.converted()) {
                conversions++;
            }
            revenue += session.conversionValueOrZero();
            engagement += session.engagementRate() == null ? 0.0d : session.engagementRate();
            experience += session.experienceScore() == null ? 0 : session.experienceScore();
        }
        return new VisitorProfileDetail(
                profile,
                sessions,
                sessions.size(),
                conversions,
                revenue,
                Percentages.average(engagement, sessions.size()),
                Percentages.average(experience, sessions.size()));
    }

    private static VisitorProfilesPage.LastSession lastSession(FunnelSession session) {
        if (session == null) {
            return null;
        }
        return new VisitorProfilesPage.LastSession(
                session.geography().countryCode(),
                session.geography().countryName(),
                session.geography().city(),
                session.device().deviceType(),
                session.device().browserName());
    }
}
