package com.example.bugservice.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI bugServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Bug Service API")
                        .version("1.0.0")
                        .description("""
                                Public bug reports for software applications.

                                ## Features
                                - Anonymous or authenticated bug submission
                                - Vote toggling and comments with company responses
                                - Status workflow for company members
                                - Admin moderation: flag, remove, restore, merge duplicates
                                - Company claim and domain verification

                                ## Authentication
                                Browsing and submission are public. Everything else needs a JWT Bearer token
                                issued by the identity provider.
                                """)
                        .contact(new Contact()
                                .name("Bug Tracker Backend Team")
                                .email("backend@bugtracker.example.com")))
                .addSecurityItem(new SecurityRequirement().addList("Bearer Authentication"))
                .components(new Components()
                        .addSecuritySchemes("Bearer Authentication",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Enter your JWT access token")));
    }
}
