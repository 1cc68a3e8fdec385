package io.github.hotbrkm.campaignengine.agent.email.mime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class AttachmentLoader {

    /**
     * Reads every attachment in list order, keyed by the name recipients see.
     *
     * @throws IOException when a file is missing or unreadable
     */
    public Map<String, byte[]> getAttachmentFiles(List<AttachmentMedia> mediaList) throws IOException {
        if (mediaList.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<String, byte[]> attachmentMap = new LinkedHashMap<>();
        for (AttachmentMedia media : mediaList) {
            attachmentMap.put(media.fileName(), Files.readAllBytes(Path.of(media.filePath())));
        }
        return attachmentMap;
    }
}
