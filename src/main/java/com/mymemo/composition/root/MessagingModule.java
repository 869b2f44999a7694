package com.mymemo.composition.root;

import com.mymemo.config.BotConfig;
import com.mymemo.service.FallbackTextIntelligence;
import com.mymemo.service.MessageSender;
import com.mymemo.service.OpenAiTextIntelligence;
import com.mymemo.service.TextIntelligence;
import com.mymemo.service.TwilioMessageSender;
import com.google.inject.AbstractModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MessagingModule extends AbstractModule {
    private static final Logger log = LoggerFactory.getLogger(MessagingModule.class);

    @Override
    protected void configure() {
        bind(MessageSender.class).to(TwilioMessageSender.class);
    }

    @Provides
    @Singleton
    public TextIntelligence provideTextIntelligence(BotConfig config,
                                                    Provider<OpenAiTextIntelligence> openAi,
                                                    Provider<FallbackTextIntelligence> fallback) {
        if (config.isOpenAiConfigured()) {
            log.info("Text intelligence: OpenAI model {}", config.getOpenAiModel());
            return openAi.get();
        }
        log.warn("OPENAI_API_KEY not set, intents fall back to keyword rules and summaries to truncation");
        return fallback.get();
    }
}
