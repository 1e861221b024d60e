package com.pharmascope.helix.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for HELIX service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI helixOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("HELIX API")
                        .description("""
                                HELIX - research job orchestration for PharmaScope.

                                Submit a drug, compound or indication query and poll for the consolidated report.

                                ## Features
                                - **Concurrent agents**: market, trade, patents, trials, documents, web, literature, ML, design, NLP
                                - **Partial failure**: per-agent circuit breakers with cached or estimated fallback data
                                - **Reports**: coverage ratio and composite status (COMPLETE, PARTIAL, FAILED)

                                A report with composite status FAILED is still a 200 response: inspect the status field.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("PharmaScope Engineering")))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8090").description("Local development")
                ));
    }
}
