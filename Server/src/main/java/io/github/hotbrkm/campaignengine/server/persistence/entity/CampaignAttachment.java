package io.github.hotbrkm.campaignengine.server.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CampaignAttachment {

    @Column(name = "file_name")
    private String fileName;

    @Column(name = "file_path", nullable = false, length = 1000)
    private String filePath;
}
