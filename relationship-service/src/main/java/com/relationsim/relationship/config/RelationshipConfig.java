package com.relationsim.relationship.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.relationsim.common.memory.EmotionalMemorySystem;
import com.relationsim.common.pattern.PatternTracker;
import com.relationsim.common.state.PersonalityStateManager;
import com.relationsim.common.trust.TrustDynamicsEngine;
import com.relationsim.relationship.coordinator.RelationshipCoordinator;
import com.relationsim.relationship.logger.RelationshipFlowLogger;
import com.relationsim.relationship.persistence.LoadResult;
import com.relationsim.relationship.persistence.PersistenceLayer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class RelationshipConfig {

    @Value("${relationship.session-id:default}")
    private String sessionId;

    @Value("${relationship.coordinator.queue-depth:10}")
    private int queueDepth;

    @Value("${relationship.coordinator.overflow-wait-ms:250}")
    private long overflowWaitMs;

    @Value("${relationship.withdrawal.exit-threshold:50.0}")
    private double withdrawalExitThreshold;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /** Single thread, so saves run strictly in submission order. */
    @Bean(destroyMethod = "dispose")
    public Scheduler persistenceScheduler() {
        return Schedulers.newSingle("relationship-persistence");
    }

    /** Manager restored from the default save slot; defaults when nothing usable is on disk. */
    @Bean
    public PersonalityStateManager personalityStateManager(Clock clock,
                                                           PersistenceLayer persistence,
                                                           RelationshipFlowLogger flowLogger) {
        PersonalityStateManager manager = new PersonalityStateManager(
            clock,
            new PatternTracker(clock),
            new EmotionalMemorySystem(clock),
            new TrustDynamicsEngine(withdrawalExitThreshold));
        LoadResult result = persistence.load();
        flowLogger.logLoad(result, sessionId);
        manager.restore(result.snapshot());
        return manager;
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public RelationshipCoordinator relationshipCoordinator(PersonalityStateManager manager,
                                                           PersistenceLayer persistence,
                                                           RelationshipFlowLogger flowLogger,
                                                           Scheduler persistenceScheduler,
                                                           Clock clock) {
        return new RelationshipCoordinator(manager, persistence, flowLogger, persistenceScheduler,
            clock, sessionId, queueDepth, Duration.ofMillis(overflowWaitMs));
    }
}
