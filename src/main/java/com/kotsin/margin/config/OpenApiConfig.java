package com.kotsin.margin.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Margin Guard API
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Kotsin Margin Guard API")
                        .description("Margin level monitoring, loss-cut forecasting and emergency response. " +
                                "Exposes per-account risk state, forecasts, recovery scenarios, emergency mode control " +
                                "and response effect analysis.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Kotsin Development Team")
                                .email("dev@kotsin.com")
                                .url("https://kotsin.com")))
                .servers(List.of(
                        new Server()
                                .url("/")
                                .description("Relative base URL (adapts to active environment)")));
    }
}
