package com.peerwarden.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Peerwarden API Application
 * 
 * WireGuard peer provisioning on MikroTik RouterOS with local key custody.
 * Java 17 + Spring Boot 3.4.x
 */
@SpringBootApplication(scanBasePackages = "com.peerwarden")
@ConfigurationPropertiesScan(basePackages = "com.peerwarden.api.config")
@EntityScan(basePackages = "com.peerwarden.core.domain")
@EnableJpaRepositories(basePackages = "com.peerwarden.core.repository")
public class PeerwardenApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(PeerwardenApiApplication.class, args);
    }
}
