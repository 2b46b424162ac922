package com.recruit.realtime.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(DeliveryProperties.class)
public class DeliveryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
