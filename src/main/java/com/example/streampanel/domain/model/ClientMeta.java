package com.example.streampanel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Origin of a request as seen by the panel: client address and user agent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClientMeta {

    private String ipAddress;

    private String userAgent;
}
