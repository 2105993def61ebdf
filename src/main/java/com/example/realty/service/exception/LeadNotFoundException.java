package com.example.realty.service.exception;

public class LeadNotFoundException extends RuntimeException {
    public LeadNotFoundException(Long leadId) {
        super("Lead not found: " + leadId);
    }
}
