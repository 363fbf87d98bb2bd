package com.aurea.service.core.query.dashboard;

import java.util.Map;

/** @param sections analysis results keyed by section wire value, in request order */
public record DashboardResult(Map<String, Object> sections) {

    public Object section(DashboardSection section) {
        return sections.get(section.wireValue());
    }
}
