package com.example.realty.dto;

public record ReplyButton(String label, String data) {
}
