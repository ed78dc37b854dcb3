package com.fintech.resolution.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI transactionResolutionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Transaction Resolution Service API")
                        .description("REST API for identifying the card transaction a customer describes, asking for clarification when several transactions fit, and flagging the identified transaction for dispute review.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development server")
                ));
    }
}
