package org.courtside.rotation.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.courtside.rotation.config.ObjectMapperFactory;
import org.courtside.rotation.config.SchedulerProperties;
import org.courtside.rotation.ledger.Ledger;
import org.courtside.rotation.scheduler.QueueBuilder;
import org.courtside.rotation.scheduler.WeightedMatchScorer;
import org.courtside.rotation.session.SessionStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main application class for the rotation scheduler service.
 * Serves the session and player REST API and pushes queue updates over WebSocket.
 */
@SpringBootApplication(scanBasePackages = "org.courtside.rotation")
@EnableConfigurationProperties(SchedulerProperties.class)
public class RotationApplication {

    public static void main(String[] args) {
        SpringApplication.run(RotationApplication.class, args);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.create();
    }

    @Bean
    public SessionStore sessionStore(@Value("${rotation.data-dir:./data}") String dataDir) {
        return new SessionStore(Path.of(dataDir));
    }

    @Bean
    public Ledger ledger(SessionStore sessionStore) throws IOException {
        return Ledger.fromSnapshot(sessionStore.loadLedger());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService scoringExecutor(SchedulerProperties properties) {
        int threads = properties.scoringThreads() > 0
            ? properties.scoringThreads()
            : Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
        return Executors.newFixedThreadPool(threads);
    }

    @Bean
    public QueueBuilder queueBuilder(SchedulerProperties properties, ExecutorService scoringExecutor) {
        return new QueueBuilder(properties.toQueueConfig(), new WeightedMatchScorer(), scoringExecutor);
    }
}
