package io.github.hotbrkm.campaignengine.agent.email.mime;

import io.github.hotbrkm.campaignengine.agent.email.config.EmailConfig;
import io.github.hotbrkm.campaignengine.agent.email.config.EngineConfigurationException;
import io.github.hotbrkm.campaignengine.agent.email.domain.EmailAddressUtil;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Optional;

/**
 * Derives the authentication and identity headers of an outgoing message.
 * <p>
 * Message-IDs are scoped to the DKIM domain when signing is enabled, otherwise to the sender domain.
 * Unsubscribe tokens are {@code base64url(campaignId:subscriber).base64url(hmac)} under the configured secret,
 * so the unsubscribe handler can check them without a lookup.
 */
@Slf4j
public class DeliveryAuthenticator {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder TOKEN_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final EmailConfig.Smtp smtp;
    private final String unsubscribeBaseUrl;
    private final byte[] unsubscribeSecret;
    private final @Nullable DkimSigner dkimSigner;
    private final String messageIdDomain;

    public DeliveryAuthenticator(EmailConfig emailConfig, @Nullable DkimSigner dkimSigner) {
        this.smtp = emailConfig.getSmtp();
        this.dkimSigner = dkimSigner;

        String from = smtp.getFrom();
        if (from == null || EmailAddressUtil.INVALID.equals(EmailAddressUtil.extractDomain(from))) {
            throw new EngineConfigurationException("email.smtp.from must be a valid address: " + from);
        }
        String secret = emailConfig.getTracking().getUnsubscribeSecret();
        if (secret == null || secret.isBlank()) {
            throw new EngineConfigurationException("Missing email.tracking.unsubscribe-secret");
        }
        this.unsubscribeSecret = secret.getBytes(StandardCharsets.UTF_8);
        this.unsubscribeBaseUrl = emailConfig.getTracking().resolveUnsubscribeBaseUrl();
        this.messageIdDomain = dkimSigner != null ? dkimSigner.getDomain() : EmailAddressUtil.extractDomain(from);
    }

    public IdentityHeaders identityHeaders(long campaignId, @Nullable Long subscriberId, String recipientEmail) {
        String token = unsubscribeToken(campaignId, subscriberKey(subscriberId, recipientEmail));
        return new IdentityHeaders(
                MessageIdGenerator.next(messageIdDomain),
                smtp.resolveReturnPath(),
                "<" + unsubscribeBaseUrl + "/unsubscribe/" + token + ">",
                IdentityHeaders.ONE_CLICK);
    }

    /**
     * @return the DKIM-Signature value, or empty when signing is disabled
     */
    public Optional<String> sign(String rawMessage) {
        if (dkimSigner == null) {
            return Optional.empty();
        }
        return Optional.of(dkimSigner.sign(rawMessage));
    }

    public String unsubscribeToken(long campaignId, String subscriberKey) {
        byte[] payload = (campaignId + ":" + subscriberKey).getBytes(StandardCharsets.UTF_8);
        return TOKEN_ENCODER.encodeToString(payload) + "." + TOKEN_ENCODER.encodeToString(hmac(payload));
    }

    /**
     * @return {@code campaignId:subscriber} when the token carries a valid signature
     */
    public Optional<String> verifyUnsubscribeToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot == token.length() - 1) {
            return Optional.empty();
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(token.substring(0, dot));
            byte[] signature = Base64.getUrlDecoder().decode(token.substring(dot + 1));
            if (!MessageDigest.isEqual(hmac(payload), signature)) {
                return Optional.empty();
            }
            return Optional.of(new String(payload, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            log.debug("event=unsubscribe_token_malformed");
            return Optional.empty();
        }
    }

    public boolean isSigningEnabled() {
        return dkimSigner != null;
    }

    private byte[] hmac(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(unsubscribeSecret, HMAC_ALGORITHM));
            return mac.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(HMAC_ALGORITHM + " unavailable", e);
        }
    }

    private static String subscriberKey(@Nullable Long subscriberId, String recipientEmail) {
        return subscriberId != null ? subscriberId.toString() : recipientEmail.trim().toLowerCase();
    }
}
