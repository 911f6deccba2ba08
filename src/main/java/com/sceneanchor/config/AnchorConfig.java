package com.sceneanchor.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AnchorConfig {

    public static final String RESOLUTION_EXECUTOR = "anchorResolutionExecutor";

    @Value("${anchor.delta.parallelism:4}")
    private int parallelism;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Worker pool for per-span resolution on large documents. Passed explicitly to the
     * delta engine; nothing else shares it.
     */
    @Bean(name = RESOLUTION_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService anchorResolutionExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "anchor-resolve-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, parallelism), threadFactory);
    }
}
