package com.aurea.service.core.query.event;

import java.util.List;

public record EventDevicesResult(String eventName, long totalEvents, long totalDevices, List<DeviceRow> devices) {

    public record DeviceRow(String deviceType, long count, double revenue, double percentage) {}
}
