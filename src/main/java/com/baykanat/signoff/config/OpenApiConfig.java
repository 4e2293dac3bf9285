package com.baykanat.signoff.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI signoffComplianceOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Signoff Compliance - Ingestion & Report API")
                        .description("""
                                Ingests contract signoff attestations, recomputes signoff compliance \
                                reports (history, qualification status, never signed off, risk bucket) \
                                against a pinned as-of timestamp and serves them as paginated row sets.\
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Burak Aykanat")
                                .email("burak.aykanat12@gmail.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
