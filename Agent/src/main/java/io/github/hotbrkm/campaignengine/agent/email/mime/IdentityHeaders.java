package io.github.hotbrkm.campaignengine.agent.email.mime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-message identity: Message-ID, bounce address and one-click unsubscribe headers.
 */
public record IdentityHeaders(String messageId, String returnPath, String listUnsubscribe, String listUnsubscribePost) {

    public static final String ONE_CLICK = "List-Unsubscribe=One-Click";

    Map<String, String> asHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (returnPath != null && !returnPath.isBlank()) {
            headers.put("Return-Path", "<" + returnPath + ">");
        }
        if (listUnsubscribe != null) {
            headers.put("List-Unsubscribe", listUnsubscribe);
            headers.put("List-Unsubscribe-Post", listUnsubscribePost);
        }
        return headers;
    }
}
