package com.aurea.service.core.query.visitor;

import com.aurea.service.core.model.VisitorProfile;
import java.util.List;

/** @param nextCursor id of the last returned profile, null when this is the last page */
public record VisitorProfilesPage(List<Item> items, String nextCursor) {

    public record Item(VisitorProfile profile, LastSession lastSession) {}

    /** Where and on what the visitor was last seen in this funnel. */
    public record LastSession(
            String countryCode, String countryName, String city, String deviceType, String browserName) {}
}
