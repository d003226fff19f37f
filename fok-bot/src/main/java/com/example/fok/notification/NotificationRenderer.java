package com.example.fok.notification;

import com.example.fok.domain.ApplicationStatus;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.HtmlUtils;

/**
 * Turns a notification template and its parameters into HTML message text.
 */
@Component
public class NotificationRenderer {

    public String render(Notification notification) {
        Map<String, String> params = notification.getParams() != null ? notification.getParams() : Map.of();
        return switch (notification.getTemplate()) {
            case APPLICATION_CREATED -> renderCreated(params);
            case APPLICATION_STATUS_CHANGED -> renderStatusChanged(params);
        };
    }

    private String renderCreated(Map<String, String> params) {
        StringBuilder text = new StringBuilder();
        text.append("🆕 <b>Новая заявка #").append(value(params, "shortId")).append("</b>\n\n");
        text.append("👤 ").append(value(params, "userName"));
        if (StringUtils.hasText(params.get("username"))) {
            text.append(" (@").append(value(params, "username")).append(')');
        }
        text.append('\n');
        text.append("📱 ").append(value(params, "phone")).append('\n');
        text.append("🏢 ").append(value(params, "facilityName"));
        if (StringUtils.hasText(params.get("district"))) {
            text.append(", ").append(value(params, "district"));
        }
        text.append('\n');
        text.append("🏅 ").append(value(params, "sport"));
        return text.toString();
    }

    private String renderStatusChanged(Map<String, String> params) {
        return "📋 <b>Статус вашей заявки #" + value(params, "shortId") + " изменен</b>\n\n"
                + "🏢 " + value(params, "facilityName") + "\n"
                + "🏅 " + value(params, "sport") + "\n\n"
                + "Новый статус: " + statusName(params.get("status"));
    }

    private String statusName(String status) {
        if (!StringUtils.hasText(status)) {
            return "—";
        }
        try {
            return ApplicationStatus.valueOf(status).getDisplayName();
        } catch (IllegalArgumentException ex) {
            return HtmlUtils.htmlEscape(status);
        }
    }

    private String value(Map<String, String> params, String key) {
        String raw = params.get(key);
        return StringUtils.hasText(raw) ? HtmlUtils.htmlEscape(raw) : "—";
    }
}
