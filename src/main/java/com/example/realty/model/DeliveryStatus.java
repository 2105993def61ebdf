package com.example.realty.model;

public enum DeliveryStatus {
    DELIVERED,
    /** last reply could not be handed to the transport */
    PENDING
}
