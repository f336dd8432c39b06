package com.caltrack.backend.config;

import com.caltrack.backend.common.time.StoreTimeProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(StoreTimeProperties.class)
public class TimeConfig {

    /** tests override with a @Primary fixed clock */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
