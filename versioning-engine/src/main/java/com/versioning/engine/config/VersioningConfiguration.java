package com.versioning.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.versioning.core.codec.DraftPayloadCodec;
import com.versioning.core.repository.*;
import com.versioning.engine.coordinator.DraftCoordinator;
import com.versioning.engine.coordinator.DraftPromotionService;
import com.versioning.engine.coordinator.ResourceCoordinator;
import com.versioning.engine.metrics.VersioningMetrics;
import com.versioning.engine.persistence.*;
import com.versioning.engine.service.DraftService;
import com.versioning.engine.service.ResourceService;
import com.versioning.engine.validation.DraftValidator;
import com.versioning.engine.validation.EntityChecks;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the draft and resource services over the configured store.
 *
 * With {@code versioning.store=jdbc} (the default) the Jdbc* repositories are
 * picked up by component scanning; with {@code memory} the in-memory stores below are used.
 */
@Configuration
@EnableConfigurationProperties(VersioningProperties.class)
public class VersioningConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock versioningClock() {
        return Clock.systemUTC();
    }

    @Bean
    public DraftPayloadCodec draftPayloadCodec(ObjectMapper objectMapper) {
        return new DraftPayloadCodec(objectMapper);
    }

    @Bean
    public EntityChecks entityChecks(
            ResourceRepository resourceRepository,
            SnapshotRepository snapshotRepository,
            DraftRepository draftRepository,
            GroupDirectory groupDirectory) {
        return new EntityChecks(resourceRepository, snapshotRepository, draftRepository, groupDirectory);
    }

    @Bean
    public DraftValidator draftValidator(EntityChecks entityChecks, ResourceRepository resourceRepository) {
        return new DraftValidator(entityChecks, resourceRepository);
    }

    @Bean
    public DraftService draftService(
            DraftRepository draftRepository,
            ResourceRepository resourceRepository,
            EntityChecks entityChecks,
            DraftValidator draftValidator,
            VersioningMetrics metrics,
            Clock clock) {
        return new DraftCoordinator(draftRepository, resourceRepository, entityChecks, draftValidator, metrics, clock);
    }

    @Bean
    public ResourceService resourceService(
            ResourceRepository resourceRepository,
            SnapshotRepository snapshotRepository,
            ResourceLockRepository lockRepository,
            EntityChecks entityChecks,
            VersioningMetrics metrics,
            Clock clock) {
        return new ResourceCoordinator(
            resourceRepository, snapshotRepository, lockRepository, entityChecks, metrics, clock);
    }

    @Bean
    public DraftPromotionService draftPromotionService(
            DraftRepository draftRepository,
            ResourceRepository resourceRepository,
            ResourceService resourceService,
            EntityChecks entityChecks,
            VersioningMetrics metrics) {
        return new DraftPromotionService(draftRepository, resourceRepository, resourceService, entityChecks, metrics);
    }

    /**
     * In-memory stores, for embedding without a database.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "versioning", name = "store", havingValue = "memory")
    public static class InMemoryStoreConfiguration {

        @Bean
        public ResourceLockRepository resourceLockRepository() {
            return new InMemoryResourceLockRepository();
        }

        @Bean
        public DependencyRuleRepository dependencyRuleRepository() {
            return new InMemoryDependencyRuleRepository();
        }

        @Bean
        public ResourceRepository resourceRepository(
                ResourceLockRepository lockRepository,
                DependencyRuleRepository ruleRepository) {
            return new InMemoryResourceRepository(lockRepository, ruleRepository);
        }

        @Bean
        public SnapshotRepository snapshotRepository() {
            return new InMemorySnapshotRepository();
        }

        @Bean
        public DraftRepository draftRepository() {
            return new InMemoryDraftRepository();
        }

        @Bean
        public InMemoryGroupDirectory groupDirectory() {
            return new InMemoryGroupDirectory();
        }
    }
}
