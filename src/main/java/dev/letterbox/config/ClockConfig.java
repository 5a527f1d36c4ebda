package dev.letterbox.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class ClockConfig {

    /**
     * UTC clock used for subscription timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
