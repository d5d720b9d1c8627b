package com.example.streampanel.api.request;

import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AuthLoginRequest {

    /**
     * Username or email.
     */
    @NotBlank
    private String username;

    @NotBlank
    private String password;
}
