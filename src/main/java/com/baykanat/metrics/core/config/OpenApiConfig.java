package com.baykanat.metrics.core.config;

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
    public OpenAPI metricsCoreOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Metrics Core - Points, Queries & Segments API")
                        .description("""
                                Stores time-series metric points for arbitrary entities with idempotent upserts, \
                                exposes bucketed aggregation queries with drilldown back to raw points, and \
                                classifies entities through rule-based segments and table buckets.\
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
