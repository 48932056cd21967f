package com.promptoptimizer.infrastructure.pipeline;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class OptimizationExecutorConfig {

    @Value("${optimizer.batch.parallelism:4}")
    private int parallelism;

    @Bean(destroyMethod = "shutdown")
    public ExecutorService optimizationExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "optimizer-batch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, parallelism), threadFactory);
    }
}
