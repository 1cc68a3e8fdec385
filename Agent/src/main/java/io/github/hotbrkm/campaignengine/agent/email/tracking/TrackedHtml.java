package io.github.hotbrkm.campaignengine.agent.email.tracking;

import java.util.List;

public record TrackedHtml(String html, List<LinkMapping> links) {
}
