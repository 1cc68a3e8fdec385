package io.github.hotbrkm.campaignengine.agent.email.mime;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file attached to every message of a campaign. {@code fileName} is the name recipients see;
 * {@code filePath} is where the agent reads the bytes from at compose time.
 */
public record AttachmentMedia(String fileName, String filePath) {

    public AttachmentMedia {
        Objects.requireNonNull(filePath, "filePath must not be null");
        if (fileName == null || fileName.isBlank()) {
            fileName = Path.of(filePath).getFileName().toString();
        }
    }
}
