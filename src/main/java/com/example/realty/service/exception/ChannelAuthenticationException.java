package com.example.realty.service.exception;

public class ChannelAuthenticationException extends RuntimeException {
    public ChannelAuthenticationException(String message) {
        super(message);
    }

    public ChannelAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
