package io.github.hotbrkm.campaignengine.agent.email.domain;

import lombok.Getter;

import java.util.Objects;

/**
 * Sending profile of one recipient domain.
 */
@Getter
public class EmailDomain {
    private final String domainName;
    private final long sendDelayMs;

    /**
     * EmailDomain constructor.
     *
     * @param domainName  Domain name
     * @param sendDelayMs Delay added before each send to this domain (in milliseconds)
     */
    public EmailDomain(String domainName, long sendDelayMs) {
        this.domainName = domainName;
        this.sendDelayMs = Math.max(0L, sendDelayMs);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        EmailDomain that = (EmailDomain) o;
        return Objects.equals(domainName, that.domainName);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(domainName);
    }
}
