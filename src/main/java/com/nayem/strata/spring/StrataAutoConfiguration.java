package com.nayem.strata.spring;

import com.nayem.strata.merge.MergeEngine;
import com.nayem.strata.model.DocumentCodec;
import com.nayem.strata.override.OverrideSynthesizer;
import com.nayem.strata.override.OverrideTracker;
import com.nayem.strata.source.NetworkGateway;
import com.nayem.strata.source.SourceManager;
import com.nayem.strata.store.DocumentStore;
import com.nayem.strata.store.InMemoryDocumentStore;
import com.nayem.strata.store.RedisDocumentStore;
import com.nayem.strata.tracking.ChangeTracker;
import com.nayem.strata.tracking.RemoteContext;
import com.nayem.strata.tracking.SourceBaselines;
import com.nayem.strata.validation.ReferenceValidator;
import com.nayem.strata.validation.SchemaValidator;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@EnableConfigurationProperties(StrataProperties.class)
public class StrataAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DocumentCodec documentCodec() {
        return new DocumentCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaValidator schemaValidator(DocumentCodec codec) {
        return new SchemaValidator(codec.mapper());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReferenceValidator referenceValidator() {
        return new ReferenceValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public MergeEngine mergeEngine(ReferenceValidator referenceValidator) {
        return new MergeEngine(referenceValidator);
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentStore documentStore(StrataProperties properties, DocumentCodec codec,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider) {
        String backend = properties.getStore().getBackend();
        return switch (backend.toLowerCase()) {
            case "redis" -> {
                StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
                if (redis == null) {
                    throw new IllegalStateException("A StringRedisTemplate is required for the Redis document store");
                }
                yield new RedisDocumentStore(redis, codec.mapper(), properties.getStore().getKeyPrefix());
            }
            default -> new InMemoryDocumentStore();
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public SourceBaselines sourceBaselines() {
        return new SourceBaselines();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(NetworkGateway.class)
    public SourceManager sourceManager(NetworkGateway gateway, DocumentStore store, SchemaValidator validator,
            MergeEngine mergeEngine, SourceBaselines sourceBaselines, DocumentCodec codec,
            StrataProperties properties, ObjectProvider<MeterRegistry> registryProvider) {
        return SourceManager.builder()
                .gateway(gateway)
                .store(store)
                .validator(validator)
                .mergeEngine(mergeEngine)
                .sourceBaselines(sourceBaselines)
                .codec(codec)
                .metrics(registryProvider.getIfAvailable())
                .fetchTimeout(properties.getFetchTimeout())
                .defaultBranch(properties.getDefaultBranch())
                .cacheTtl(properties.getCache().getTtl())
                .cacheMaxSize(properties.getCache().getMaxSize())
                .maxPendingUpdates(properties.getWorker().getMaxPendingUpdates())
                .maxCoalesceIterations(properties.getWorker().getMaxCoalesceIterations())
                .shutdownTimeout(properties.getShutdownTimeout())
                .shutdownPollingInterval(properties.getShutdownPollingInterval())
                .threadNamePrefix(properties.getThreadNamePrefix())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public OverrideSynthesizer overrideSynthesizer() {
        return new OverrideSynthesizer();
    }

    @Bean
    @ConditionalOnMissingBean
    public OverrideTracker overrideTracker(OverrideSynthesizer synthesizer) {
        return new OverrideTracker(synthesizer);
    }

    /**
     * Without a source manager nothing is linked, so divergence is never
     * reported.
     */
    @Bean
    @ConditionalOnMissingBean
    public ChangeTracker changeTracker(DocumentStore store, ObjectProvider<SourceManager> sourceManagerProvider,
            OverrideTracker overrideTracker, SourceBaselines sourceBaselines, DocumentCodec codec) {
        SourceManager sourceManager = sourceManagerProvider.getIfAvailable();
        RemoteContext remote = sourceManager != null ? sourceManager : RemoteContext.DISCONNECTED;
        return new ChangeTracker(store, remote, overrideTracker, sourceBaselines, codec);
    }
}
