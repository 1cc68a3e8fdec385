package io.github.hotbrkm.campaignengine.agent.email.content;

/**
 * Campaign content before per-recipient resolution. Fields may contain spintax and {@code {{token}}} placeholders.
 * With {@code weightedSpintax} set, a {@code :weight} suffix on an option sets its draw weight; otherwise the
 * suffix is ordinary text and every option is equally likely.
 */
public record MessageTemplate(String subject, String html, String text, boolean weightedSpintax) {

    public MessageTemplate {
        subject = subject == null ? "" : subject;
        html = html == null ? "" : html;
        text = text == null ? "" : text;
    }

    public MessageTemplate(String subject, String html, String text) {
        this(subject, html, text, false);
    }
}
