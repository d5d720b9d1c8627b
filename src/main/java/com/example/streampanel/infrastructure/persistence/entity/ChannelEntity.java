package com.example.streampanel.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class ChannelEntity {
    private Long id;
    private String name;
    private String streamUrl;
    private String streamType;
    private String quality;
    private String status;
}
