package com.mymemo.dto;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/**
 * Twilio messaging reply: {@code <Response><Message>...</Message></Response>}.
 */
@JacksonXmlRootElement(localName = "Response")
public class TwimlResponse {

    @JacksonXmlProperty(localName = "Message")
    private final String message;

    public TwimlResponse(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
