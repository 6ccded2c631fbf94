package com.z254.butterfly.triage.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for the TRIAGE service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8087}")
    private int serverPort;

    @Bean
    public OpenAPI triageOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("TRIAGE Alert Correlation API")
                        .description("""
                                TRIAGE reduces raw alert streams into incident groups for the BUTTERFLY ecosystem.

                                ## Features

                                - **Correlation**: Weighted similarity clustering of alerts into incident groups
                                - **Root Cause Analysis**: Heuristic causal ranking within each group
                                - **Suppression**: Optional dropping of redundant, non-critical alerts

                                ## Integration

                                TRIAGE consumes detector alerts from Kafka and publishes group summaries
                                for notification routing and self-healing action selection.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("BUTTERFLY Team")
                                .email("butterfly@254studioz.com")
                                .url("https://254carbon.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server"),
                        new Server()
                                .url("http://triage-service:8087")
                                .description("Kubernetes service")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Alerts")
                                .description("Alert ingestion and suppression checks"),
                        new Tag()
                                .name("Groups")
                                .description("Incident group queries and maintenance")
                ));
    }
}
