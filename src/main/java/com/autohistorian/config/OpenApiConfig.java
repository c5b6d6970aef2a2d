package com.autohistorian.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("AutoHistorian API")
                        .version("0.1.0")
                        .description("Spring Boot WebFlux API for news ingestion, fact extraction, and topic timelines."))
                .addTagsItem(new Tag().name("ingest").description("Fetch documents and run the extraction pipeline"))
                .addTagsItem(new Tag().name("topics").description("Read-only topic summaries and dual timelines"));
    }
}
