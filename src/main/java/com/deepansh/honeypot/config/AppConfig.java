package com.deepansh.honeypot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    /** Injected wherever "now" matters so timeout logic can be driven from tests. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
