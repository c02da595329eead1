package com.example.finance.fincheck.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
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
        title = "FinCheck API",
        version = "v1",
        description = "Validation and cleaning of financial records, worksheets and calculation inputs.",
        contact = @Contact(name = "FinCheck Team", email = "support@fincheck.local")
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
            .title("FinCheck API")
            .version("v1")
            .description("Swagger UI for the field, record and tabular validation endpoints.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi validationApi() {
    return GroupedOpenApi.builder()
        .group("validation")
        .packagesToScan("com.example.finance.fincheck.controller")
        .pathsToMatch("/v1/**")
        .build();
  }
}
