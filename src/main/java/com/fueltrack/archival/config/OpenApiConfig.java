package com.fueltrack.archival.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI configuration.
 * Swagger UI is served at /swagger-ui.html and the OpenAPI JSON at /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

        @Value("${spring.application.name:fuel-archival-service}")
        private String applicationName;

        @Bean
        public OpenAPI customOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title(applicationName + " API")
                                                .version("1.0.0")
                                                .description("""
                                                                Data lifecycle management for fleet and fuel records.

                                                                ## Features
                                                                - **Archival Runs**: Batch migration of aged records into archive collections
                                                                - **Dry Runs**: Preview what a run would move without changing data
                                                                - **Restore**: Move archived records back, with an explicit collision policy
                                                                - **Statistics**: Active and archived volumes per entity type

                                                                ## Authentication
                                                                All endpoints require Basic Authentication. Use the Authorize button to set credentials.
                                                                """)
                                                .contact(new Contact()
                                                                .name("Fuel Tracking Platform Team")
                                                                .email("support@example.com")))
                                .servers(List.of(
                                                new Server()
                                                                .url("http://localhost:8080")
                                                                .description("Local Development")))
                                .tags(List.of(
                                                new Tag().name("Archival")
                                                                .description("Archival runs, restore and statistics")))
                                .addSecurityItem(new SecurityRequirement().addList("basicAuth"))
                                .components(new Components()
                                                .addSecuritySchemes("basicAuth", new SecurityScheme()
                                                                .type(SecurityScheme.Type.HTTP)
                                                                .scheme("basic")
                                                                .description("Basic Authentication with username and password")));
        }
}
