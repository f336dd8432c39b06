package com.caltrack.backend.dailylog.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DailyLogProperties.class)
public class DailyLogConfig {}
