package io.github.hotbrkm.campaignengine.agent.email.content;

import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a campaign template into the subject and bodies sent to one recipient.
 * <p>
 * Steps run in a fixed order:
 * <ol>
 *   <li>spintax expansion of subject, html and text, each with its own draw, weighted when the template says so</li>
 *   <li>profile and clock tokens; a missing profile value becomes an empty string</li>
 *   <li>{@code {{time_greeting}}} from the server clock hour</li>
 *   <li>{@code {{local_time}}} in the recipient's timezone</li>
 *   <li>{@code {{industry_content}}} from the industry lookup</li>
 * </ol>
 */
@Slf4j
public class ContentPersonalizer {

    static final String GENERIC_INDUSTRY_CONTENT = "Personalized content for your business";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    private static final Map<String, String> INDUSTRY_CONTENT = Map.of(
            "technology", "Latest tech innovations and digital solutions",
            "healthcare", "Advanced healthcare solutions and patient care",
            "finance", "Financial insights and investment opportunities",
            "education", "Educational resources and learning opportunities"
    );

    private final SpintaxExpander spintaxExpander;

    public ContentPersonalizer(SpintaxExpander spintaxExpander) {
        this.spintaxExpander = Objects.requireNonNull(spintaxExpander, "spintaxExpander must not be null");
    }

    public PersonalizedContent personalize(MessageTemplate template, RecipientProfile profile, SendContext context) {
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(context, "context must not be null");

        String subject = spin(template, template.subject(), context);
        String html = spin(template, template.html(), context);
        String text = spin(template, template.text(), context);

        Map<String, String> tokens = buildTokens(profile, context);
        return new PersonalizedContent(replaceAll(subject, tokens), replaceAll(html, tokens), replaceAll(text, tokens));
    }

    private String spin(MessageTemplate template, String value, SendContext context) {
        return template.weightedSpintax()
                ? spintaxExpander.expandWeighted(value, context.random())
                : spintaxExpander.expand(value, context.random());
    }

    private Map<String, String> buildTokens(RecipientProfile profile, SendContext context) {
        ZonedDateTime now = ZonedDateTime.now(context.clock());

        Map<String, String> tokens = new LinkedHashMap<>();
        tokens.put("{{first_name}}", orEmpty(profile.firstName()));
        tokens.put("{{last_name}}", orEmpty(profile.lastName()));
        tokens.put("{{email}}", orEmpty(profile.email()));
        tokens.put("{{company}}", orEmpty(profile.company()));
        tokens.put("{{city}}", orEmpty(profile.city()));
        tokens.put("{{country}}", orEmpty(profile.country()));
        tokens.put("{{current_date}}", now.format(DATE_FORMAT));
        tokens.put("{{current_time}}", now.format(TIME_FORMAT));
        tokens.put("{{random_number}}", String.valueOf(context.random().nextInt(1000, 10000)));

        tokens.put("{{time_greeting}}", greetingFor(now.getHour()));
        tokens.put("{{local_time}}", localTime(now, profile.timezone()).format(TIME_FORMAT));
        tokens.put("{{industry_content}}", industryContent(profile.industry()));
        return tokens;
    }

    static String greetingFor(int hour) {
        if (hour < 12) {
            return "Good morning";
        }
        if (hour < 17) {
            return "Good afternoon";
        }
        return "Good evening";
    }

    static String industryContent(String industry) {
        if (industry == null) {
            return GENERIC_INDUSTRY_CONTENT;
        }
        return INDUSTRY_CONTENT.getOrDefault(industry.trim().toLowerCase(Locale.ROOT), GENERIC_INDUSTRY_CONTENT);
    }

    // Without a usable timezone the server clock stands in
    private ZonedDateTime localTime(ZonedDateTime now, String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return now;
        }
        try {
            return now.withZoneSameInstant(ZoneId.of(timezone.trim()));
        } catch (DateTimeException e) {
            log.debug("timezone={}, event=personalize_invalid_timezone", timezone);
            return now;
        }
    }

    private static String replaceAll(String value, Map<String, String> tokens) {
        if (value.indexOf("{{") < 0) {
            return value;
        }
        String result = value;
        for (Map.Entry<String, String> token : tokens.entrySet()) {
            result = result.replace(token.getKey(), token.getValue());
        }
        return result;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
