package com.peerwarden.api.config;

import com.peerwarden.api.keys.Curve25519KeyStrategy;
import com.peerwarden.api.keys.KeyGenerationService;
import com.peerwarden.api.keys.KeyGenerationStrategy;
import com.peerwarden.api.keys.WgToolKeyStrategy;
import com.peerwarden.api.keys.WgToolLocator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Ranks the key generation backends: native {@code wg} first when preferred,
 * the in-process Curve25519 backend always last.
 */
@Configuration
public class KeyGenerationConfig {

    @Bean
    public KeyGenerationService keyGenerationService(KeyGenerationProperties properties) {
        List<KeyGenerationStrategy> ranked = new ArrayList<>();
        if (properties.preferNativeTool()) {
            WgToolLocator locator = new WgToolLocator(properties.toolPaths(), properties.probeTimeout());
            ranked.add(new WgToolKeyStrategy(locator, properties.invocationTimeout()));
        }
        ranked.add(new Curve25519KeyStrategy());
        return new KeyGenerationService(ranked);
    }
}
