package com.caltrack.backend.scaling;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ScalingProperties.class)
public class ScalingConfig {}
