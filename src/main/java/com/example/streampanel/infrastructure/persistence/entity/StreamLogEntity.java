package com.example.streampanel.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * One row per admitted stream. A row with a null {@code endTime} is an active stream and
 * counts against its account's concurrency cap.
 */
@Data
public class StreamLogEntity {

    private Long id;

    private Long userId;

    private Long channelId;

    private String streamUrl;

    private String ipAddress;

    private String userAgent;

    private String licenseKey;

    private LocalDateTime startTime;

    private LocalDateTime relayStartedAt;

    private LocalDateTime relayHeartbeatAt;

    private LocalDateTime endTime;

    private Long durationSec;

    private Long bytesTransferred;

    private String closeReason;
}
