package com.moveinsync.fleetcompliance.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Fleet Compliance API")
                        .description("Vehicle document compliance tracking, expiry alerts and audit trail. "
                                + "Pass the acting user in the X-User-Id header.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("MoveInSync Fleet")
                                .email("fleet@moveinsync.com"))
                        .license(new License()
                                .name("MIT License")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
