package com.decoadmin.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.random.RandomGenerator;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared time and randomness sources so services never call {@code now()} or
 * {@code new Random()} directly and tests can pin both.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public RandomGenerator randomGenerator() {
        return RandomGenerator.getDefault();
    }
}
