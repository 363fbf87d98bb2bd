package com.aurea.controller.rest;

import com.aurea.service.core.bucket.BucketGranularity;
import com.aurea.service.core.model.LifecycleStage;
import com.aurea.service.core.repo.VisitorProfileFilter;

final class AnalyticsParams {

    private AnalyticsParams() {}

    /** Null when absent so each analysis applies its own default. */
    static BucketGranularity granularity(String value) {
        return value == null || value.isBlank() ? null : BucketGranularity.fromConfigValue(value);
    }

    static VisitorProfileFilter visitorFilter(String lifecycleStage, Boolean hasIdentified, String search) {
        return new VisitorProfileFilter(LifecycleStage.fromValue(lifecycleStage), hasIdentified, search);
    }
}
