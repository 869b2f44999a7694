package com.mymemo;

import com.mymemo.composition.root.CompositionRoot;
import com.mymemo.config.MonitoringConfig;
import com.mymemo.server.WebServer;
import com.mymemo.service.ReminderDispatcher;
import com.mymemo.service.ReminderScheduler;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.name.Names;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.persistence.EntityManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        Injector injector;
        WebServer webServer;
        try {
            injector = Guice.createInjector(new CompositionRoot());
            webServer = injector.getInstance(WebServer.class);
            webServer.start();
        } catch (Exception e) {
            log.error("Failed to start reminder bot", e);
            System.exit(1);
            return;
        }

        ReminderScheduler scheduler = injector.getInstance(ReminderScheduler.class);
        scheduler.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(injector, webServer), "shutdown"));
        log.info("Reminder bot is running");
    }

    static void shutdown(Injector injector, WebServer webServer) {
        log.info("Shutting down reminder bot");
        injector.getInstance(ReminderScheduler.class).stop();
        injector.getInstance(ReminderDispatcher.class).close();

        try {
            webServer.stop();
        } catch (Exception e) {
            log.error("Error stopping web server", e);
        }

        ExecutorService engineExecutor = injector.getInstance(
                Key.get(ExecutorService.class, Names.named("engineExecutor")));
        engineExecutor.shutdown();
        try {
            if (!engineExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                engineExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            engineExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        injector.getInstance(EntityManagerFactory.class).close();
        injector.getInstance(HikariDataSource.class).close();
        injector.getInstance(MonitoringConfig.class).close();
        log.info("Shutdown complete");
    }
}
