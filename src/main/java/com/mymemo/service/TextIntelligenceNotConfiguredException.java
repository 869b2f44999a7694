package com.mymemo.service;

public class TextIntelligenceNotConfiguredException extends RuntimeException {

    public TextIntelligenceNotConfiguredException() {
        super("Text intelligence is not configured");
    }
}
