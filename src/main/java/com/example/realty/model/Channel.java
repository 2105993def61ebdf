package com.example.realty.model;

public enum Channel {
    TELEGRAM,
    WHATSAPP
}
