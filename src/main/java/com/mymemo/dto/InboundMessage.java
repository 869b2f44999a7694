package com.mymemo.dto;

public record InboundMessage(String from, String body) {

    public boolean isEmpty() {
        return from == null || from.isBlank() || body == null || body.isBlank();
    }
}
