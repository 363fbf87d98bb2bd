package com.aurea.service.core.api;

public class VisitorNotFoundException extends AnalyticsNotFoundException {

    public VisitorNotFoundException(String visitorId) {
        super("Visitor profile not found: " + visitorId);
    }
}
