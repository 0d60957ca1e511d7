package com.keystone.core.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans for the governance core.
 */
@Configuration
@EnableConfigurationProperties(KeystoneProperties.class)
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Bounded pool running task pipelines; extra submissions wait in the queue. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor(KeystoneProperties props) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, props.getEngine().getConcurrency()), r -> {
            Thread t = new Thread(r, "pipeline-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
