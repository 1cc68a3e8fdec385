package io.github.hotbrkm.campaignengine.server.attribution;

import io.github.hotbrkm.campaignengine.server.persistence.entity.ConversionType;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies a clicked URL into a conversion type by keyword. Buckets are checked in declaration order and the
 * first match wins.
 */
@Component
public class ConversionClassifier {

    private static final Map<ConversionType, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(ConversionType.PURCHASE, List.of("purchase", "buy", "order", "checkout", "payment"));
        KEYWORDS.put(ConversionType.SIGNUP, List.of("signup", "register", "join", "subscribe"));
        KEYWORDS.put(ConversionType.DOWNLOAD, List.of("download", "pdf", "ebook", "whitepaper"));
        KEYWORDS.put(ConversionType.CONTACT, List.of("contact", "demo", "consultation", "meeting"));
    }

    public Optional<ConversionType> classify(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String lower = url.toLowerCase(Locale.ROOT);
        return KEYWORDS.entrySet().stream()
                .filter(entry -> entry.getValue().stream().anyMatch(lower::contains))
                .map(Map.Entry::getKey)
                .findFirst();
    }
}
