package com.example.realty.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertySummary {
    private Long id;
    private String title;
    private String location;
    private String propertyType;
    private BigDecimal price;
    private String currency;
    private String imageUrl;
}
