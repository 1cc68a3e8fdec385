package io.github.hotbrkm.campaignengine.agent.email.domain;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * EmailDomainManager manages and provides per-domain sending profiles.
 */
public class EmailDomainManager {

    private static final String DEFAULT = "default";
    private final Map<String, EmailDomain> emailDomainMap = new HashMap<>();
    private final EmailDomain defaultEmailDomain;

    /**
     * @param emailDomainList      domains with their own profile
     * @param defaultSendDelayMs   delay for every other domain
     */
    public EmailDomainManager(List<EmailDomain> emailDomainList, long defaultSendDelayMs) {
        this.defaultEmailDomain = new EmailDomain(DEFAULT, defaultSendDelayMs);
        updateEmailDomains(emailDomainList);
    }

    public static EmailDomainManager fromDelays(Map<String, Long> delays, long defaultSendDelayMs) {
        List<EmailDomain> domains = delays == null ? List.of() : delays.entrySet().stream()
                .map(entry -> new EmailDomain(entry.getKey(), entry.getValue() == null ? 0L : entry.getValue()))
                .toList();
        return new EmailDomainManager(domains, defaultSendDelayMs);
    }

    /**
     * Returns the EmailDomain object corresponding to the given domain name.
     * Returns the default EmailDomain if the domain name does not exist.
     */
    public synchronized EmailDomain getEmailDomain(String domainName) {
        EmailDomain emailDomain = emailDomainMap.get(domainName == null ? null : domainName.toLowerCase(Locale.ROOT));

        if (emailDomain != null) {
            return emailDomain;
        }

        return emailDomainMap.getOrDefault(DEFAULT, defaultEmailDomain);
    }

    /**
     * Replaces all data with the given list of EmailDomain objects.
     */
    public synchronized void updateEmailDomains(List<EmailDomain> emailDomainList) {
        List<EmailDomain> safeList = emailDomainList == null ? Collections.emptyList() : emailDomainList;
        emailDomainMap.clear();
        for (EmailDomain emailDomain : safeList) {
            emailDomainMap.put(emailDomain.getDomainName().toLowerCase(Locale.ROOT), emailDomain);
        }
    }

    public synchronized List<String> getEmailDomainNames() {
        return emailDomainMap.keySet().stream().toList();
    }
}
