package com.mlops_lifecycle.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.*;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Value("${server.port:8000}")
    private int serverPort;

    @Bean
    public OpenAPI modelServingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("MLOps Model Serving API")
                        .version("1.0.0")
                        .description("Serves the production classifier. The model is acquired once at startup, from the registry's Production stage or, failing that, from the local production artifact.")
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html"))
                )
                .servers(List.of(
                        new Server().url("http://localhost:" + serverPort).description("Local server")
                ));
    }


    @Bean
    public GroupedOpenApi servingApi() {
        return GroupedOpenApi.builder()
                .group("Model Serving APIs")
                .pathsToMatch("/**")
                .build();
    }
}
