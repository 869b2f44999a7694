package com.mymemo.config;

import com.google.inject.Singleton;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class MonitoringConfig implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MonitoringConfig.class);
    private final PrometheusMeterRegistry prometheusRegistry;
    private JvmGcMetrics gcMetrics;

    public MonitoringConfig() {
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        prometheusRegistry.config().commonTags("application", "mymemo-bot");
        registerMetrics();
        log.info("Micrometer Prometheus registry initialized");
    }

    private void registerMetrics() {
        gcMetrics = new JvmGcMetrics();
        new ClassLoaderMetrics().bindTo(prometheusRegistry);
        new JvmMemoryMetrics().bindTo(prometheusRegistry);
        gcMetrics.bindTo(prometheusRegistry);
        new ProcessorMetrics().bindTo(prometheusRegistry);
        new JvmThreadMetrics().bindTo(prometheusRegistry);
    }

    public MeterRegistry getMeterRegistry() {
        return prometheusRegistry;
    }

    public PrometheusMeterRegistry getPrometheusRegistry() {
        return prometheusRegistry;
    }

    @Override
    public void close() {
        try {
            gcMetrics.close();
            prometheusRegistry.close();
            log.info("Metrics registry closed");
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }
    }
}
