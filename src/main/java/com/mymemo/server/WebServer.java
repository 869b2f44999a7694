package com.mymemo.server;

import com.mymemo.resource.ManagementResource;
import com.mymemo.resource.TwilioWebhookResource;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.handler.StatisticsHandler;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.glassfish.jersey.jackson.JacksonFeature;
import org.glassfish.jersey.server.ResourceConfig;
import org.glassfish.jersey.servlet.ServletContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public class WebServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WebServer.class);
    private Server server;
    private final int port;
    private final Duration shutdownTimeout;
    private final TwilioWebhookResource webhookResource;
    private final ManagementResource managementResource;

    public WebServer(int port,
                     Duration shutdownTimeout,
                     TwilioWebhookResource webhookResource,
                     ManagementResource managementResource) {
        this.port = port;
        this.shutdownTimeout = shutdownTimeout;
        this.webhookResource = webhookResource;
        this.managementResource = managementResource;
    }

    public void start() throws Exception {
        server = new Server(port);

        // lets stop() wait for in-flight requests
        StatisticsHandler statistics = new StatisticsHandler();
        statistics.setHandler(createApiContext());
        server.setHandler(statistics);
        server.setStopTimeout(shutdownTimeout.toMillis());
        server.setStopAtShutdown(false);

        server.start();
        logServerInfo();
    }

    private ServletContextHandler createApiContext() {
        ServletContextHandler apiContext = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        apiContext.setContextPath("/");

        ResourceConfig apiConfig = new ResourceConfig();
        apiConfig.register(webhookResource);
        apiConfig.register(managementResource);
        apiConfig.register(JacksonFeature.class);

        ServletHolder apiHolder = new ServletHolder("api", new ServletContainer(apiConfig));
        apiHolder.setAsyncSupported(true);
        apiContext.addServlet(apiHolder, "/*");

        return apiContext;
    }

    private void logServerInfo() {
        log.info("Server started on port: {}", port);
        log.info("Twilio webhook: http://localhost:{}/twilio/webhook", port);
        log.info("Health: http://localhost:{}/health", port);
    }

    public void stop() throws Exception {
        if (server != null && server.isRunning()) {
            log.info("Stopping web server, waiting up to {} for in-flight requests", shutdownTimeout);
            server.stop();
            log.info("Web server stopped");
        }
    }

    @Override
    public void close() throws Exception {
        stop();
    }
}
