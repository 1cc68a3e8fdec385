package io.github.hotbrkm.campaignengine.server.persistence.entity;

public enum ConversionType {
    PURCHASE,
    SIGNUP,
    DOWNLOAD,
    CONTACT
}
