package com.github.dimitryivaniuta.scoped.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the scoped API gateway.
 * Bootstraps Spring WebFlux, R2DBC and the scope engine.
 */
@Slf4j
@SpringBootApplication
public class ApiGatewayApplication {

    /**
     * Launches the gateway.
     *
     * @param args command-line arguments passed to the application
     */
    public static void main(final String[] args) {
        SpringApplication.run(ApiGatewayApplication.class, args);
        log.info("API Gateway application started successfully.");
    }
}
