package com.example.securevote.config;

import com.example.securevote.util.StripedLocks;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared by the voter state machine and the ballot store; neither holds more than one
     * stripe at a time. Two keys landing on one stripe only cost contention.
     */
    @Bean
    public StripedLocks tokenLocks(VoteProperties properties) {
        return new StripedLocks(properties.getLockStripes());
    }
}
