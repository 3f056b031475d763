package com.phillippitts.voicegate.config;

import com.phillippitts.voicegate.config.properties.CacheProperties;
import com.phillippitts.voicegate.config.properties.MetricsProperties;
import com.phillippitts.voicegate.config.properties.StorageProperties;
import com.phillippitts.voicegate.service.cache.CacheKeyFactory;
import com.phillippitts.voicegate.service.cache.CacheStore;
import com.phillippitts.voicegate.service.cache.InMemoryCacheStore;
import com.phillippitts.voicegate.service.cache.ResultCache;
import com.phillippitts.voicegate.service.cache.ResultCodec;
import com.phillippitts.voicegate.service.metrics.InMemoryMetricSampleStore;
import com.phillippitts.voicegate.service.metrics.MetricSampleStore;
import com.phillippitts.voicegate.service.metrics.MetricsRecorder;
import com.phillippitts.voicegate.service.metrics.SpeechMetrics;
import com.phillippitts.voicegate.service.provider.process.DefaultProcessFactory;
import com.phillippitts.voicegate.service.provider.process.ProcessRunner;
import com.phillippitts.voicegate.service.storage.FileSystemObjectStorage;
import com.phillippitts.voicegate.service.storage.ObjectStorage;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Backing stores and shared utilities. Cache, sample and object stores are the in-process defaults.
 */
@Configuration
public class InfrastructureConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProcessRunner processRunner() {
        return new ProcessRunner(new DefaultProcessFactory());
    }

    @Bean
    public SpeechMetrics speechMetrics(MeterRegistry meterRegistry) {
        return new SpeechMetrics(meterRegistry);
    }

    @Bean
    public InMemoryCacheStore cacheStore(CacheProperties props, Clock clock) {
        return new InMemoryCacheStore(props.getMaxEntries(), clock);
    }

    @Bean
    public ResultCache resultCache(CacheStore store, CacheProperties props, SpeechMetrics metrics) {
        return new ResultCache(store, new CacheKeyFactory(props.getKeyPrefix()), new ResultCodec(), props, metrics);
    }

    @Bean
    public InMemoryMetricSampleStore metricSampleStore(MetricsProperties props, Clock clock) {
        return new InMemoryMetricSampleStore(props.getMaxSamples(), Duration.ofDays(props.getRetentionDays()),
                clock);
    }

    @Bean
    public MetricsRecorder metricsRecorder(MetricSampleStore store, SpeechMetrics metrics,
                                           @Qualifier("metricsExecutor") Executor metricsExecutor) {
        return new MetricsRecorder(store, metrics, metricsExecutor);
    }

    @Bean
    public FileSystemObjectStorage objectStorage(StorageProperties props) {
        return new FileSystemObjectStorage(Path.of(props.getBaseDir()));
    }
}
