package com.peerwarden.api.config;

import com.peerwarden.routeros.RouterOsClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RouterOS REST client built from {@link RouterProperties}.
 */
@Configuration
public class RouterClientConfig {

    @Bean(destroyMethod = "close")
    public RouterOsClient routerOsClient(RouterProperties properties) {
        return RouterOsClient.builder()
                .baseUrl(properties.baseUrl())
                .username(properties.username())
                .password(properties.password())
                .connectTimeout(properties.connectTimeout())
                .requestTimeout(properties.requestTimeout())
                .build();
    }
}
