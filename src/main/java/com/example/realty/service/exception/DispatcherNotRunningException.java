package com.example.realty.service.exception;

public class DispatcherNotRunningException extends RuntimeException {
    public DispatcherNotRunningException(String message) {
        super(message);
    }
}
