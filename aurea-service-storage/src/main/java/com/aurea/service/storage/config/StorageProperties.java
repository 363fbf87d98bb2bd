package com.aurea.service.storage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** JDBC tuning for the analytics read queries. Zero leaves the driver default in place. */
@Component
@ConfigurationProperties(prefix = "aurea.storage")
public class StorageProperties {
    private int queryTimeoutSeconds = 30;
    private int fetchSize = 500;

    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public int getFetchSize() {
        return fetchSize;
    }

    public void setFetchSize(int fetchSize) {
        this.fetchSize = fetchSize;
    }
}
