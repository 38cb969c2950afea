package com.receiptly.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String OWNER_SCHEME_NAME = "owner-header";

    @Bean
    public OpenAPI receiptlyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Receiptly API")
                        .description("Receipt extraction, review and reconciliation.")
                        .version("v1"))
                // The gateway authenticates the caller and forwards the owner id.
                .components(new Components()
                        .addSecuritySchemes(OWNER_SCHEME_NAME,
                                new SecurityScheme()
                                        .name("X-Owner-Id")
                                        .type(SecurityScheme.Type.APIKEY)
                                        .in(SecurityScheme.In.HEADER)))
                .addSecurityItem(new SecurityRequirement().addList(OWNER_SCHEME_NAME));
    }
}
