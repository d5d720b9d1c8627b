package com.example.streampanel.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreamStartResponse {

    private Long logId;
    private String proxyUrl;
    private Long channelId;
    private String channelName;
    private String quality;
    private Long claimTimeoutSeconds;
}
