package com.tenantgate.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tenantgate.storage")
public class StorageProperties {

    private String blobRoot = "./data/blobs";
    private String durableRoot = "./data/durable";

    public String getBlobRoot() { return blobRoot; }
    public void setBlobRoot(String blobRoot) { this.blobRoot = blobRoot; }
    public String getDurableRoot() { return durableRoot; }
    public void setDurableRoot(String durableRoot) { this.durableRoot = durableRoot; }
}
