package com.mymemo.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntentClassifierTest {

    @Mock
    private TextIntelligence textIntelligence;

    private IntentClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new IntentClassifier(new DeleteTargetParser(), textIntelligence);
    }

    @ParameterizedTest
    @ValueSource(strings = {"clear all reminders", "Clear Reminders", "  delete all reminders  "})
    void classify_WhenExactClearPhrase_ShouldClear(String message) {
        assertEquals(Intent.CLEAR_REMINDERS, classifier.classify(message).intent());
        verify(textIntelligence, never()).classifyIntent(anyString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"list reminders", "Show my reminders please", "can you list every reminder?"})
    void classify_WhenListRequest_ShouldList(String message) {
        assertEquals(Intent.LIST_REMINDERS, classifier.classify(message).intent());
        verify(textIntelligence, never()).classifyIntent(anyString());
    }

    @Test
    void classify_WhenDeleteWithTarget_ShouldCarryKeyword() {
        IntentResolution resolution = classifier.classify("delete reminder about rent");

        assertEquals(Intent.DELETE_REMINDER, resolution.intent());
        assertEquals("rent", resolution.deleteKeyword());
    }

    @Test
    void classify_WhenClearPhraseHasExtraWords_ShouldNotClear() {
        when(textIntelligence.classifyIntent("clear all reminders about work"))
                .thenReturn(CompletableFuture.completedFuture("add_reminder"));

        IntentResolution resolution = classifier.classify("clear all reminders about work");

        assertEquals(Intent.ADD_REMINDER, resolution.intent());
    }

    @Test
    void classify_WhenModelReturnsLabel_ShouldUseIt() {
        when(textIntelligence.classifyIntent("how does this work"))
                .thenReturn(CompletableFuture.completedFuture(" HELP\n"));

        assertEquals(Intent.HELP, classifier.classify("how does this work").intent());
    }

    @Test
    void classify_WhenModelReturnsUnknown_ShouldAdd() {
        when(textIntelligence.classifyIntent("pick up the kids"))
                .thenReturn(CompletableFuture.completedFuture("unknown"));

        assertEquals(Intent.ADD_REMINDER, classifier.classify("pick up the kids").intent());
    }

    @Test
    void classify_WhenModelFails_ShouldAdd() {
        when(textIntelligence.classifyIntent("pick up the kids"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("status 500")));

        assertEquals(Intent.ADD_REMINDER, classifier.classify("pick up the kids").intent());
    }

    @Test
    void classify_WhenModelNotConfigured_ShouldAdd() {
        when(textIntelligence.classifyIntent("pick up the kids"))
                .thenReturn(CompletableFuture.failedFuture(new TextIntelligenceNotConfiguredException()));

        assertEquals(Intent.ADD_REMINDER, classifier.classify("pick up the kids").intent());
    }

    @Test
    void classify_WhenModelSaysDelete_ShouldHaveEmptyKeyword() {
        when(textIntelligence.classifyIntent("get rid of the milk one"))
                .thenReturn(CompletableFuture.completedFuture("delete_reminder"));

        IntentResolution resolution = classifier.classify("get rid of the milk one");

        assertEquals(Intent.DELETE_REMINDER, resolution.intent());
        assertEquals("", resolution.deleteKeyword());
    }
}
