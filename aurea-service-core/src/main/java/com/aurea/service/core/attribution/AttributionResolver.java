package com.aurea.service.core.attribution;

import com.aurea.service.core.model.FunnelSession;
import com.aurea.service.core.model.Geography;
import com.aurea.service.core.model.TouchAttribution;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Resolves first/last-touch channels and session geography.
 *
 * <p>Click identifiers are checked in a fixed order: {@code fbclid}, {@code gclid}, {@code ttclid}. The same order
 * applies to both touch sides. Geography falls back to the newest event of the session carrying any geography
 * field, only when the session knows neither a country code nor a country name.
 */
@Component
public class AttributionResolver {

    public TouchResolution resolveTouch(FunnelSession session, TouchSide side) {
        TouchAttribution touch = side == TouchSide.FIRST ? session.firstTouch() : session.lastTouch();
        if (present(touch.fbclid())) {
            return new TouchResolution(AdPlatform.FACEBOOK, true);
        }
        if (present(touch.gclid())) {
            return new TouchResolution(AdPlatform.GOOGLE, true);
        }
        if (present(touch.ttclid())) {
            return new TouchResolution(AdPlatform.TIKTOK, true);
        }
        return new TouchResolution(AdPlatform.DIRECT, false);
    }

    /** Session ids whose own geography is unknown; these are fetched in one batch. */
    public Set<String> sessionsNeedingGeoFallback(Collection<FunnelSession> sessions) {
        Set<String> ids = new LinkedHashSet<>();
        for (FunnelSession session : sessions) {
            if (session.geography().countryUnknown() && session.sessionId() != null) {
                ids.add(session.sessionId());
            }
        }
        return ids;
    }

    /** Picks, per session, the newest sighting that carries any geography field. */
    public Map<String, Geography> latestPerSession(Collection<GeoSighting> sightings) {
        List<GeoSighting> newestFirst = sightings.stream()
                .filter(s -> s.geography() != null && s.geography().hasAnyField())
                .sorted(Comparator.comparing(
                        GeoSighting::timestamp, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        Map<String, Geography> out = new HashMap<>();
        for (GeoSighting sighting : newestFirst) {
            out.putIfAbsent(sighting.sessionId(), sighting.geography());
        }
        return out;
    }

    /**
     * Resolved geography with {@code countryCode} defaulting to {@code Unknown} and {@code countryName} defaulting
     * to the code.
     */
    public Geography resolveGeography(FunnelSession session, Map<String, Geography> fallbacks) {
        Geography own = session.geography();
        Geography fallback = own.countryUnknown() && fallbacks != null ? fallbacks.get(session.sessionId()) : null;

        String countryCode = Geography.isKnown(own.countryCode())
                ? own.countryCode()
                : fallback != null ? fallback.countryCode() : null;
        String countryName = Geography.isKnown(own.countryName())
                ? own.countryName()
                : fallback != null ? fallback.countryName() : null;
        String city = firstNonBlank(own.city(), fallback != null ? fallback.city() : null);
        String region = firstNonBlank(own.region(), fallback != null ? fallback.region() : null);

        String code = Geography.isKnown(countryCode) ? countryCode : Geography.UNKNOWN;
        String name = Geography.isKnown(countryName) ? countryName : code;
        return new Geography(code, name, region, city);
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a;
        }
        return b != null && !b.isBlank() ? b : null;
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
