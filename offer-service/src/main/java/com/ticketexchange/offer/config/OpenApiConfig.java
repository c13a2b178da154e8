package com.ticketexchange.offer.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8083}")
    private String serverPort;

    @Bean
    public OpenAPI offerServiceOpenAPI() {
        Server localServer = new Server()
                .url("http://localhost:" + serverPort)
                .description("Local Development Server");

        Contact contact = new Contact()
                .name("Ticket Offer Exchange Team")
                .email("support@ticketexchange.com");

        Info info = new Info()
                .title("Offer Service API")
                .version("1.0.0")
                .description("Offer Service lets buyers place price-ceiling offers backed by a payment hold " +
                            "and lets sellers fulfil them. Acceptance is settled under a row lock so only one " +
                            "seller can win an offer; the held payment is captured once the match is recorded.")
                .contact(contact);

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
