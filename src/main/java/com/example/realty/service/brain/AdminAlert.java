package com.example.realty.service.brain;

import java.time.LocalDateTime;

/**
 * What the tenant's admin is told about a lead. Rendering is left to {@code AdminAlertFormatter}.
 */
public record AdminAlert(AlertKind kind,
                         Long tenantId,
                         Long leadId,
                         String leadName,
                         String phone,
                         String goal,
                         String lastMessage,
                         LocalDateTime timestamp) {
}
