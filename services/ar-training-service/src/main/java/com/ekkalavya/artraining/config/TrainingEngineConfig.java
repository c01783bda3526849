package com.ekkalavya.artraining.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Enables {@link TrainingEngineProperties} and wires the clock and transaction
 * template used by the session services.
 */
@Configuration
@EnableConfigurationProperties(TrainingEngineProperties.class)
@Slf4j
public class TrainingEngineConfig {

    public TrainingEngineConfig() {
        log.info("Initializing AR training engine configuration");
    }

    @Bean
    public Clock trainingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TransactionOperations trainingTransactions(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
