package io.github.hotbrkm.campaignengine.agent.email.send.server;

import java.util.Locale;

public enum SmtpSecurity {
    NONE,
    STARTTLS,
    SSL;

    public static SmtpSecurity from(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "STARTTLS", "TLS" -> STARTTLS;
            case "SSL", "SMTPS" -> SSL;
            default -> NONE;
        };
    }
}
