package com.aurea.service.core.api;

/** Base type for lookups that fail the whole request. */
public class AnalyticsNotFoundException extends RuntimeException {

    public AnalyticsNotFoundException(String message) {
        super(message);
    }
}
