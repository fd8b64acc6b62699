package com.dockyard.core.presence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "dockyard.presence")
public class PresenceProperties {

    private boolean reaperEnabled = true;
    private Duration heartbeatInterval = Duration.ofSeconds(15);
    private Duration reaperInterval = Duration.ofSeconds(30);
    private Duration startupCeiling = Duration.ofSeconds(30);
    private Duration gracePeriod = Duration.ofSeconds(30);
    private Duration idleTimeout = Duration.ofSeconds(60);
    private Duration probeTimeout = Duration.ofSeconds(2);

    public boolean isReaperEnabled() { return reaperEnabled; }
    public void setReaperEnabled(boolean reaperEnabled) { this.reaperEnabled = reaperEnabled; }
    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
    public Duration getReaperInterval() { return reaperInterval; }
    public void setReaperInterval(Duration reaperInterval) { this.reaperInterval = reaperInterval; }
    public Duration getStartupCeiling() { return startupCeiling; }
    public void setStartupCeiling(Duration startupCeiling) { this.startupCeiling = startupCeiling; }
    public Duration getGracePeriod() { return gracePeriod; }
    public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }
    public Duration getIdleTimeout() { return idleTimeout; }
    public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }
    public Duration getProbeTimeout() { return probeTimeout; }
    public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }
}
