package com.tenantgate.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "tenantgate.control-plane")
public class ControlPlaneProperties {

    private String url;
    private String internalApiKey;
    private Duration timeout = Duration.ofSeconds(10);
    private Duration cacheTtl = Duration.ofSeconds(60);

    public boolean isConfigured() {
        return url != null && !url.isBlank();
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getInternalApiKey() { return internalApiKey; }
    public void setInternalApiKey(String internalApiKey) { this.internalApiKey = internalApiKey; }
    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public Duration getCacheTtl() { return cacheTtl; }
    public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
}
