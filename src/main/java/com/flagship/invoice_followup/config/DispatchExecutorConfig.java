package com.flagship.invoice_followup.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for the dispatch engine.
 *
 * Two pools, so a hung provider call can never starve the workers that would time it out:
 * - dispatchExecutor runs one job per candidate (claim, render, send, record)
 * - providerCallExecutor runs the provider call itself under a bounded timeout
 */
@Configuration
public class DispatchExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService dispatchExecutor(
            @Value("${followup.dispatch.parallelism:8}") int parallelism) {
        return Executors.newFixedThreadPool(parallelism, namedThreads("followup-dispatch-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerCallExecutor(
            @Value("${followup.dispatch.parallelism:8}") int parallelism) {
        return Executors.newFixedThreadPool(parallelism * 2, namedThreads("provider-call-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
