package com.courtcapture.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CaptureConfig {

    @Bean(name = "credentialExecutor", destroyMethod = "shutdown")
    public ExecutorService credentialExecutor(CaptureProperties properties) {
        return Executors.newFixedThreadPool(properties.getResolver().getConcurrency());
    }

    @Bean(name = "captureRunExecutor", destroyMethod = "shutdown")
    public ExecutorService captureRunExecutor(CaptureProperties properties) {
        return Executors.newFixedThreadPool(properties.getScheduler().getRunConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor() {
        return Executors.newFixedThreadPool(4);
    }

    @Bean
    public Clock clock(CaptureProperties properties) {
        return Clock.system(properties.getScheduler().zoneId());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
