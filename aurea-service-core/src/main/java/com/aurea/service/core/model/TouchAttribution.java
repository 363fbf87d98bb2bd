package com.aurea.service.core.model;

/**
 * UTM fields and ad-platform click identifiers captured at one touch point of a session.
 */
public record TouchAttribution(
        String source, String medium, String campaign, String fbclid, String gclid, String ttclid) {

    public static TouchAttribution empty() {
        return new TouchAttribution(null, null, null, null, null, null);
    }
}
