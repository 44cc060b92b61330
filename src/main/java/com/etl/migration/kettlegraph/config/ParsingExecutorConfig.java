package com.etl.migration.kettlegraph.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Worker pool used to parse the files of a folder in parallel.
 * Reads the pool size from application.yml; 0 means one thread per available core.
 */
@Configuration
@Slf4j
public class ParsingExecutorConfig {

    public static final String PARSING_EXECUTOR = "kettleParsingExecutor";

    @Value("${kettle-graph.parsing.pool-size:0}")
    private int poolSize;

    @Bean(name = PARSING_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService kettleParsingExecutor() {
        int threads = poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
        log.info("[Parsing Config] Initializing parsing executor with {} thread(s)", threads);
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("kettle-parse-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
