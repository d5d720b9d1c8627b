package com.example.streampanel.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.stream")
public class AppStreamProperties {

    private int connectTimeoutMs = 30000;

    /**
     * Idle read timeout on the upstream socket. Also bounds how long a silent upstream can
     * hide a client disconnect.
     */
    private int readTimeoutMs = 30000;

    private int maxUpstreamConnections = 500;

    private int maxUpstreamConnectionsPerRoute = 100;

    private int relayBufferBytes = 65536;

    /**
     * Admitted streams whose relay has not started within this window are closed as
     * UNCLAIMED.
     */
    private long claimTimeoutSeconds = 60;

    private long reaperIntervalMs = 15000;

    /**
     * Claimed streams with no relay heartbeat for this long are closed as ORPHANED. Live
     * relays heartbeat on every reaper run, so keep this well above the reaper interval.
     */
    private long relayStaleSeconds = 120;

    /**
     * Sent upstream when the client supplied no User-Agent.
     */
    private String defaultUserAgent = "Stream-Panel/1.0";

    private String proxyPathPrefix = "/api/v1/streams";
}
