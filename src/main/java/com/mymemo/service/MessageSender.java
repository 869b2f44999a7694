package com.mymemo.service;

import java.util.concurrent.CompletableFuture;

public interface MessageSender {

    CompletableFuture<String> send(String userId, String text);
}
