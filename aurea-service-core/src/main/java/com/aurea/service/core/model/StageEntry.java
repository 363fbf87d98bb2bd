package com.aurea.service.core.model;

import java.time.Instant;

public record StageEntry(String stage, Instant enteredAt) {}
