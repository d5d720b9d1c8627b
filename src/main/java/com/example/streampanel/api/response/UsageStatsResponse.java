package com.example.streampanel.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UsageStatsResponse {

    private String period;
    private Long totalStreams;
    private Long totalDurationSec;
    private Double avgDurationSec;
    private Long uniqueChannels;
    private Long totalBytes;
}
