package com.example.realty.dto;

import com.example.realty.model.Channel;

public record AdminAddressRequest(Channel channel, String address) {
}
