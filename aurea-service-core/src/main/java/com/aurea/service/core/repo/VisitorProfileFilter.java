package com.aurea.service.core.repo;

import com.aurea.service.core.model.LifecycleStage;
import com.aurea.service.core.model.VisitorProfile;
import java.util.Locale;

/**
 * @param hasIdentified true keeps identified visitors only, false anonymous only, null both
 * @param searchQuery case-insensitive substring of display name or identified user id
 */
public record VisitorProfileFilter(LifecycleStage lifecycleStage, Boolean hasIdentified, String searchQuery) {

    public static VisitorProfileFilter none() {
        return new VisitorProfileFilter(null, null, null);
    }

    public boolean hasSearch() {
        return searchQuery != null && !searchQuery.isBlank();
    }

    public boolean matches(VisitorProfile profile) {
        if (lifecycleStage != null && lifecycleStage != profile.lifecycleStage()) {
            return false;
        }
        if (hasIdentified != null && hasIdentified != (profile.identifiedUserId() != null)) {
            return false;
        }
        if (!hasSearch()) {
            return true;
        }
        String needle = searchQuery.toLowerCase(Locale.ROOT);
        return contains(profile.displayName(), needle) || contains(profile.identifiedUserId(), needle);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
