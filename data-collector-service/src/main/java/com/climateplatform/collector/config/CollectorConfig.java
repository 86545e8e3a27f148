package com.climateplatform.collector.config;

import com.climateplatform.collector.cache.ArrowDatasetCacheStore;
import com.climateplatform.collector.registry.SourceDescriptor;
import com.climateplatform.collector.registry.SourceRegistry;
import com.climateplatform.collector.service.FetchCoordinator;
import com.climateplatform.collector.service.HistoricalBackfillService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(CollectorProperties.class)
public class CollectorConfig {

    private static final Logger log = LoggerFactory.getLogger(CollectorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SourceRegistry sourceRegistry(CollectorProperties properties) {
        List<SourceDescriptor> descriptors = new ArrayList<>();
        properties.sources().forEach((id, source) -> {
            if (source.baseUrl() == null || source.baseUrl().isBlank()) {
                throw new IllegalStateException("collector.sources." + id + ".base-url is required");
            }
            Map<String, Object> defaults = source.defaults() == null
                ? Map.of()
                : new LinkedHashMap<>(source.defaults());
            descriptors.add(new SourceDescriptor(
                id,
                source.baseUrl(),
                source.apiKey(),
                source.timeout() != null ? source.timeout() : properties.fetch().defaultTimeout(),
                source.maxRetries(),
                source.retryBackoff(),
                defaults));
        });
        SourceRegistry registry = new SourceRegistry(descriptors);
        log.info("Source registry built. sources={}", registry.sourceIds());
        return registry;
    }

    @Bean(destroyMethod = "close")
    public ArrowDatasetCacheStore datasetCacheStore(CollectorProperties properties) {
        return new ArrowDatasetCacheStore(properties.cache().directory());
    }

    @Bean
    public HistoricalBackfillService historicalBackfillService(FetchCoordinator coordinator,
                                                               CollectorProperties properties) {
        return new HistoricalBackfillService(coordinator,
                                             properties.backfill().concurrency(),
                                             properties.backfill().maxDays());
    }
}
