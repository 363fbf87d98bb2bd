package com.aurea.service.core.model;

public record DeviceInfo(
        String deviceType, String browserName, String browserVersion, String osName, String osVersion) {

    public static DeviceInfo unknown() {
        return new DeviceInfo(null, null, null, null, null);
    }
}
