package com.example.datalake.docqa.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoreConfig {

    /** Cache hit timestamps and retention cut-offs are computed from this clock. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
