package com.signaldesk.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // HttpClient internals only; nothing may block on send() from these threads
    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(PipelineProperties properties) {
        int size = Math.max(4, properties.getScheduler().getMaxConcurrentJobs() * 2);
        return Executors.newFixedThreadPool(size, namedThreads("pipeline-http-"));
    }

    @Bean(name = "feedExecutor", destroyMethod = "shutdown")
    public ExecutorService feedExecutor(PipelineProperties properties) {
        int size = Math.max(2, properties.getScheduler().getMaxConcurrentJobs());
        return Executors.newFixedThreadPool(size, namedThreads("pipeline-feed-"));
    }

    @Bean(name = "jobExecutor")
    public ExecutorService jobExecutor(PipelineProperties properties) {
        return Executors.newFixedThreadPool(properties.getScheduler().getMaxConcurrentJobs(), namedThreads("pipeline-job-"));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
