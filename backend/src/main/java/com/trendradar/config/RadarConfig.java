package com.trendradar.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class RadarConfig {

    @Bean(name = "fetchExecutor", destroyMethod = "shutdown")
    public ExecutorService fetchExecutor(RadarProperties properties) {
        return Executors.newFixedThreadPool(properties.getFetch().getConcurrency(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("radar-fetch");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(RadarProperties properties) {
        int size = Math.max(2, properties.getFetch().getConcurrency());
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
