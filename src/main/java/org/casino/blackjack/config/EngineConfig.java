package org.casino.blackjack.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Slf4j
@Configuration
@EnableConfigurationProperties(SessionProperties.class)
public class EngineConfig {

    /** Source aléatoire unique du shoe : graine fixe pour rejouer une session. */
    @Bean
    public Random shoeRandom(SessionProperties props) {
        if (props.getSeed() != null) {
            log.info("Shoe initialisé avec la graine {}", props.getSeed());
            return new Random(props.getSeed());
        }
        return new SecureRandom();
    }
}
