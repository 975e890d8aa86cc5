package com.ospicorp.anomalyapi.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Anomaly Detection API")
            .version("v1")
            .description("Train versioned per-series models and classify points against them")
            .contact(new Contact().name("Anomaly Platform Team").email("api-support@example.com")))
        .servers(List.of(new Server().url("/")))
        .externalDocs(new ExternalDocumentation()
            .description("Error reference")
            .url("https://developers.company.com/docs/errors/"));
  }
}
