package com.example.streampanel.infrastructure.persistence.model;

import lombok.Data;

@Data
public class UsageStatsRow {
    private Long totalStreams;
    private Long totalDurationSec;
    private Double avgDurationSec;
    private Long uniqueChannels;
    private Long totalBytes;
}
