package com.example.todoserver.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TodoProperties.class)
public class TodoConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
