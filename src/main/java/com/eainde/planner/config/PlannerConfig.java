package com.eainde.planner.config;

import com.eainde.planner.content.RandomSourceFactory;
import com.eainde.planner.thread.MdcAwareExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Wiring for the collaborators the stages take from outside: clock, randomness
 * and the day executor.
 */
@Log4j2
@Configuration
public class PlannerConfig {

    @Bean
    public Clock plannerClock() {
        return Clock.systemUTC();
    }

    /** Empty {@code planner.random-seed} means a fresh seed per application start. */
    @Bean
    public RandomSourceFactory randomSourceFactory(@Value("${planner.random-seed:}") String seed) {
        long resolved = seed == null || seed.isBlank()
                ? ThreadLocalRandom.current().nextLong()
                : Long.parseLong(seed.trim());
        log.info("Template selection seeded with {}", resolved);
        return new RandomSourceFactory(resolved);
    }

    @Bean(name = "dayExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor dayExecutor(@Value("${planner.day-workers:4}") int workers) {
        return new MdcAwareExecutor(workers);
    }
}
