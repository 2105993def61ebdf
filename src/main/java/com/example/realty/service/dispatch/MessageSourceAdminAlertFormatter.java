package com.example.realty.service.dispatch;

import com.example.realty.model.Tenant;
import com.example.realty.service.brain.AdminAlert;
import com.example.realty.service.util.Msg;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.format.DateTimeFormatter;

@Configuration
public class MessageSourceAdminAlertFormatter {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");

    @Bean
    @ConditionalOnMissingBean(AdminAlertFormatter.class)
    public AdminAlertFormatter adminAlertFormatter(Msg msg) {
        return new BundleFormatter(msg);
    }

    @RequiredArgsConstructor
    static class BundleFormatter implements AdminAlertFormatter {

        private final Msg msg;

        @Override
        public String format(AdminAlert alert, Tenant tenant) {
            String unknown = msg.get("admin.alert.unknown", tenant.getDefaultLanguage());
            return msg.get("admin.alert." + alert.kind().name(), tenant.getDefaultLanguage(),
                    orDefault(alert.leadName(), unknown),
                    orDefault(alert.phone(), unknown),
                    orDefault(alert.goal(), unknown),
                    alert.timestamp() == null ? unknown : TIME.format(alert.timestamp()),
                    orDefault(alert.lastMessage(), unknown));
        }

        private static String orDefault(String value, String fallback) {
            return value == null || value.isBlank() ? fallback : value;
        }
    }
}
