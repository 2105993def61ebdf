package com.example.realty.service.dispatch;

import com.example.realty.model.Tenant;
import com.example.realty.service.brain.AdminAlert;

/**
 * Renders an admin alert. Declare another bean of this type to replace the bundled wording.
 */
public interface AdminAlertFormatter {
    String format(AdminAlert alert, Tenant tenant);
}
