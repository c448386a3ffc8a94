package com.ospicorp.nitrateforecast.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
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
            .title("Nitrate Early-Warning Forecast API")
            .version("v1")
            .description("Aligns sensor, weather and operational feeds, discovers lagged "
                + "predictors and scores seasonal forecasts over rolling windows")
            .contact(new Contact().name("Water Quality Analytics").email("analytics@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")));
  }
}
