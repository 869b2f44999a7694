package com.mymemo.resource;

import com.mymemo.dto.InboundMessage;
import com.mymemo.dto.TwimlResponse;
import com.mymemo.service.BotReplies;
import com.mymemo.service.ConversationEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.container.AsyncResponse;
import jakarta.ws.rs.container.Suspended;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

@Path("/twilio")
@Singleton
public class TwilioWebhookResource {
    private static final Logger log = LoggerFactory.getLogger(TwilioWebhookResource.class);

    private final ConversationEngine conversationEngine;
    private final ExecutorService engineExecutor;
    private final Duration timeout;
    private final XmlMapper xmlMapper = new XmlMapper();

    @Inject
    public TwilioWebhookResource(ConversationEngine conversationEngine,
                                 @Named("engineExecutor") ExecutorService engineExecutor,
                                 @Named("webhookTimeout") Duration timeout) {
        this.conversationEngine = conversationEngine;
        this.engineExecutor = engineExecutor;
        this.timeout = timeout;
    }

    @POST
    @Path("/webhook")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_XML)
    public void receiveMessage(
            @Suspended AsyncResponse asyncResponse,
            @FormParam("From") String from,
            @FormParam("Body") String body) {

        InboundMessage inbound = new InboundMessage(from, body);
        if (inbound.isEmpty()) {
            asyncResponse.resume(twiml(BotReplies.EMPTY_MESSAGE));
            return;
        }

        log.info("Inbound message from {}", inbound.from());
        log.debug("Inbound body: {}", inbound.body());

        AtomicReference<Stage> stage = new AtomicReference<>(Stage.QUEUED);
        asyncResponse.setTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);

        CompletableFuture<Response> reply = CompletableFuture.supplyAsync(() -> {
                    if (!stage.compareAndSet(Stage.QUEUED, Stage.RUNNING)) {
                        throw new CancellationException("webhook reply already sent");
                    }
                    return twiml(conversationEngine.handleMessage(inbound.from(), inbound.body()));
                }, engineExecutor)
                .exceptionally(ex -> {
                    if (stage.get() == Stage.ABANDONED) {
                        return null;
                    }
                    log.error("Error handling message from {}", inbound.from(), ex);
                    return twiml(BotReplies.BAD_REQUEST);
                });

        asyncResponse.setTimeoutHandler(ar -> {
            if (stage.compareAndSet(Stage.QUEUED, Stage.ABANDONED)) {
                reply.cancel(false);
                log.warn("Message from {} not handled within {}, asking to resend", inbound.from(), timeout);
                ar.resume(twiml(BotReplies.TRY_AGAIN));
            } else if (stage.compareAndSet(Stage.RUNNING, Stage.EXTENDED)) {
                // the engine may already have saved or deleted; wait for its real answer
                log.warn("Message from {} still being handled after {}, extending", inbound.from(), timeout);
                ar.setTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                log.error("Message from {} still being handled after {}, replying without result",
                        inbound.from(), timeout.multipliedBy(2));
                ar.resume(twiml(BotReplies.TRY_AGAIN));
            }
        });

        reply.thenAccept(response -> {
            if (response != null) {
                asyncResponse.resume(response);
            }
        });
    }

    private enum Stage { QUEUED, RUNNING, EXTENDED, ABANDONED }

    Response twiml(String message) {
        try {
            String xml = xmlMapper.writeValueAsString(new TwimlResponse(message));
            return Response.ok(xml, MediaType.APPLICATION_XML_TYPE).build();
        } catch (JsonProcessingException e) {
            log.error("TwiML encoding failed", e);
            return Response.serverError().build();
        }
    }
}
