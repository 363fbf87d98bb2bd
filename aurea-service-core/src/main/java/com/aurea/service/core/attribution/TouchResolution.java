package com.aurea.service.core.attribution;

public record TouchResolution(AdPlatform platform, boolean attributed) {}
