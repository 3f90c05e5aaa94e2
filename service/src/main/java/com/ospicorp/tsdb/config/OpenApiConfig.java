package com.ospicorp.tsdb.config;

import com.ospicorp.tsdb.security.ApiKeys;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  static final String API_KEY_SCHEME = "apiKey";

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Time Series Database API")
            .version("v1")
            .description("Write points, query series with a SQL-like language, "
                + "and run continuous queries")
            .contact(new Contact().name("TSDB Team").email("tsdb@ospicorp.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")))
        .components(new Components().addSecuritySchemes(API_KEY_SCHEME, new SecurityScheme()
            .type(SecurityScheme.Type.APIKEY)
            .in(SecurityScheme.In.HEADER)
            .name(ApiKeys.HEADER)
            .description("Database read or write key, or the admin key. "
                + "May also be passed as the " + ApiKeys.PARAMETER + " query parameter.")))
        .addSecurityItem(new SecurityRequirement().addList(API_KEY_SCHEME))
        .externalDocs(new ExternalDocumentation()
            .description("Query language reference")
            .url("https://docs.ospicorp.com/tsdb"));
  }
}
