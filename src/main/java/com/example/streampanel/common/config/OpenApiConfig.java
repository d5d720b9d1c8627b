package com.example.streampanel.common.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Documents the three places a session token is accepted. Players that cannot set
 * headers use the cookie or the query parameter on the relay URL.
 */
@Configuration
public class OpenApiConfig {

    static final String BEARER_SCHEME = "bearerToken";
    static final String COOKIE_SCHEME = "cookieToken";
    static final String QUERY_SCHEME = "queryToken";

    @Bean
    public OpenAPI streamPanelOpenApi(AppAuthProperties authProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title("Stream Panel API")
                        .description("Subscriber login, stream admission, media relay and license quotas")
                        .version("v1"))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME))
                .addSecurityItem(new SecurityRequirement().addList(COOKIE_SCHEME))
                .addSecurityItem(new SecurityRequirement().addList(QUERY_SCHEME))
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT"))
                        .addSecuritySchemes(COOKIE_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.COOKIE)
                                .name(authProperties.getTokenCookieName()))
                        .addSecuritySchemes(QUERY_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.QUERY)
                                .name(authProperties.getTokenQueryParam())));
    }
}
