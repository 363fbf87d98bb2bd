package com.aurea.controller.rest;

import java.time.Instant;

/** Structured error payload returned by the analytics endpoints. */
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {}
