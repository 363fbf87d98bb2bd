package com.aurea.service.core.attribution;

import com.aurea.service.core.model.Geography;
import java.time.Instant;

/** Geography carried by one event, used as a fallback for its session. */
public record GeoSighting(String sessionId, Geography geography, Instant timestamp) {}
