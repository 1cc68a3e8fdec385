package io.github.hotbrkm.campaignengine.agent.email.content;

public record PersonalizedContent(String subject, String html, String text) {
}
