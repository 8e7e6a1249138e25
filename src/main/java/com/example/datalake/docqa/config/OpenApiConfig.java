package com.example.datalake.docqa.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "DocQA API",
        version = "v1",
        description = "Document registration and ingestion, grounded question answering, customer query capture."
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("DocQA API")
            .version("v1")
            .description("Hybrid retrieval over ingested documents with a semantic answer cache.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi documentsApi() {
    return GroupedOpenApi.builder()
        .group("documents")
        .pathsToMatch("/api/v1/documents/**")
        .build();
  }

  @Bean
  public GroupedOpenApi questionsApi() {
    return GroupedOpenApi.builder()
        .group("questions")
        .pathsToMatch("/api/v1/questions/**", "/api/v1/customer-queries/**", "/api/v1/cache/**")
        .build();
  }
}
