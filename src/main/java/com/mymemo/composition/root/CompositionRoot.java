package com.mymemo.composition.root;

import com.mymemo.config.BotConfig;
import com.mymemo.config.MonitoringConfig;
import com.mymemo.resource.ManagementResource;
import com.mymemo.resource.TwilioWebhookResource;
import com.mymemo.server.WebServer;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import io.micrometer.core.instrument.MeterRegistry;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

public class CompositionRoot extends AbstractModule {

    @Override
    protected void configure() {
        install(new JpaModule());
        install(new MessagingModule());
    }

    @Provides
    @Singleton
    private BotConfig createBotConfig() {
        return new BotConfig();
    }

    @Provides
    @Singleton
    private MonitoringConfig createMonitoringConfig() {
        return new MonitoringConfig();
    }

    @Provides
    @Singleton
    private MeterRegistry createMeterRegistry(MonitoringConfig monitoringConfig) {
        return monitoringConfig.getMeterRegistry();
    }

    @Provides
    @Singleton
    private Clock createClock(BotConfig config) {
        return Clock.system(config.getTimezone());
    }

    @Provides
    @Singleton
    private HttpClient createHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Provides
    @Singleton
    @Named("engineExecutor")
    private ExecutorService createEngineExecutor(BotConfig config) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(config.getEngineThreads(), r -> {
            Thread thread = new Thread(r, "conversation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Provides
    @Named("webhookTimeout")
    private Duration createWebhookTimeout(BotConfig config) {
        return config.getWebhookTimeout();
    }

    @Provides
    @Singleton
    private WebServer createWebServer(BotConfig config,
                                      TwilioWebhookResource webhookResource,
                                      ManagementResource managementResource) {
        return new WebServer(config.getPort(), config.getShutdownTimeout(),
                webhookResource, managementResource);
    }
}
