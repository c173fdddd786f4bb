package com.tenantgate.tenant;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "tenantgate.lifecycle")
public class LifecycleProperties {

    /** Inactivity after which the sandbox is destroyed. */
    private Duration idleThreshold = Duration.ofMinutes(30);

    /** Wake-up interval while a sandbox is held; each wake-up flushes logs. */
    private Duration flushInterval = Duration.ofSeconds(10);

    private int timerThreads = 2;

    public Duration getIdleThreshold() { return idleThreshold; }
    public void setIdleThreshold(Duration idleThreshold) { this.idleThreshold = idleThreshold; }
    public Duration getFlushInterval() { return flushInterval; }
    public void setFlushInterval(Duration flushInterval) { this.flushInterval = flushInterval; }
    public int getTimerThreads() { return timerThreads; }
    public void setTimerThreads(int timerThreads) { this.timerThreads = timerThreads; }
}
