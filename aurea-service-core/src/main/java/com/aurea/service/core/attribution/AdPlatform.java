package com.aurea.service.core.attribution;

import com.fasterxml.jackson.annotation.JsonValue;

/** Channel inferred from click identifiers, in precedence order. */
public enum AdPlatform {
    FACEBOOK("facebook", "paid-social"),
    GOOGLE("google", "paid-search"),
    TIKTOK("tiktok", "paid-video"),
    DIRECT("direct", "direct");

    private final String wireValue;
    private final String channel;

    AdPlatform(String wireValue, String channel) {
        this.wireValue = wireValue;
        this.channel = channel;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public String channel() {
        return channel;
    }
}
