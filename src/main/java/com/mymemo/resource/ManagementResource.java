package com.mymemo.resource;

import com.mymemo.config.MonitoringConfig;
import com.mymemo.service.ConversationStateStore;
import com.mymemo.service.ReminderDispatcher;
import com.mymemo.service.ReminderScheduler;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

@Path("/")
@Singleton
public class ManagementResource {
    private static final Logger log = LoggerFactory.getLogger(ManagementResource.class);

    private final PrometheusMeterRegistry prometheusRegistry;
    private final ConversationStateStore stateStore;
    private final ReminderScheduler scheduler;
    private final ReminderDispatcher dispatcher;

    @Inject
    public ManagementResource(MonitoringConfig monitoringConfig,
                              ConversationStateStore stateStore,
                              ReminderScheduler scheduler,
                              ReminderDispatcher dispatcher) {
        this.prometheusRegistry = monitoringConfig.getPrometheusRegistry();
        this.stateStore = stateStore;
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
    }

    @GET
    @Path("/health")
    @Produces(MediaType.APPLICATION_JSON)
    public Response health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("schedulerRunning", scheduler.isRunning());
        body.put("pendingConversations", stateStore.pendingCount());
        body.put("pendingSends", dispatcher.pendingSends());
        return Response.ok(body).build();
    }

    @GET
    @Path("/metrics")
    @Produces(MediaType.TEXT_PLAIN)
    public Response metrics() {
        try {
            return Response.ok(prometheusRegistry.scrape()).build();
        } catch (RuntimeException e) {
            log.error("Failed to scrape metrics", e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity("Error scraping metrics: " + e.getMessage())
                    .build();
        }
    }
}
