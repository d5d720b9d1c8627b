package com.example.streampanel.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreamSessionResponse {

    private Long logId;
    private Long channelId;
    private String state;
    private LocalDateTime startTime;
    private LocalDateTime relayStartedAt;
    private LocalDateTime endTime;
    private Long durationSec;
    private Long bytesTransferred;
    private String closeReason;
}
