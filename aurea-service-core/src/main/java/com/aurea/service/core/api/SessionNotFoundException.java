package com.aurea.service.core.api;

public class SessionNotFoundException extends AnalyticsNotFoundException {

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
    }
}
