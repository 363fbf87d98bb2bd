package com.aurea.service.core.model;

import java.util.UUID;

/** Tenant-scoped container every session and event belongs to. */
public record Funnel(UUID id, String organizationId, String subaccountId, String name) {}
