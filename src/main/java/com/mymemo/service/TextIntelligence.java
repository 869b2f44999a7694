package com.mymemo.service;

import java.util.concurrent.CompletableFuture;

public interface TextIntelligence {

    CompletableFuture<String> classifyIntent(String text);

    CompletableFuture<String> summarize(String text);
}
