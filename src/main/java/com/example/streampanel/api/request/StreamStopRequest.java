package com.example.streampanel.api.request;

import lombok.Data;

@Data
public class StreamStopRequest {

    private Long logId;
}
