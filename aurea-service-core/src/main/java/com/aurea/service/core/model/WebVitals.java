package com.aurea.service.core.model;

/** Core Web Vitals averages; every field is nullable. */
public record WebVitals(Double lcp, Double inp, Double cls, Double fcp, Double ttfb) {

    public static WebVitals none() {
        return new WebVitals(null, null, null, null, null);
    }
}
