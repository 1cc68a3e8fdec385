package io.github.hotbrkm.campaignengine.server.attribution;

import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword based User-Agent classification. Good enough for campaign breakdowns, not a device database.
 */
@Component
public class UserAgentParser {

    private static final Pattern MOBILE = Pattern.compile("Mobile|Android|iPhone|iPad|iPod|BlackBerry|IEMobile|Opera Mini");
    private static final Pattern TABLET = Pattern.compile("iPad|Android(?!.*Mobile)|Tablet");
    private static final Pattern ANDROID_MODEL = Pattern.compile("Android [\\d.]+; ([^;)]+?)(?: Build/[^;)]*)?\\)");

    // Order matters: Android and iOS agents also name Linux and Mac OS X
    private static final List<Rule> OS_RULES = List.of(
            new Rule(Pattern.compile("Windows NT|Windows"), "Windows"),
            new Rule(Pattern.compile("iPhone|iPad|iPod"), "iOS"),
            new Rule(Pattern.compile("Android"), "Android"),
            new Rule(Pattern.compile("Mac OS X|Macintosh"), "macOS"),
            new Rule(Pattern.compile("Linux"), "Linux"));

    // Edge and Opera agents also name Chrome and Safari
    private static final List<BrowserRule> BROWSER_RULES = List.of(
            new BrowserRule(Pattern.compile("Edge?/([\\d.]+)"), "Edge", "EdgeHTML"),
            new BrowserRule(Pattern.compile("(?:OPR|Opera)/([\\d.]+)"), "Opera", "Presto"),
            new BrowserRule(Pattern.compile("Chrome/([\\d.]+)"), "Chrome", "Blink"),
            new BrowserRule(Pattern.compile("Firefox/([\\d.]+)"), "Firefox", "Gecko"),
            new BrowserRule(Pattern.compile("Version/([\\d.]+).*Safari/"), "Safari", "WebKit"));

    public DeviceInfo parse(@Nullable String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return DeviceInfo.UNKNOWN_DEVICE;
        }
        String brand = detectBrand(userAgent);
        String model = detectModel(userAgent, brand);
        String browserName = DeviceInfo.UNKNOWN;
        String browserVersion = DeviceInfo.UNKNOWN;
        String browserEngine = DeviceInfo.UNKNOWN;
        for (BrowserRule rule : BROWSER_RULES) {
            Matcher matcher = rule.pattern().matcher(userAgent);
            if (matcher.find()) {
                browserName = rule.name();
                browserVersion = matcher.group(1);
                browserEngine = rule.engine();
                break;
            }
        }
        return new DeviceInfo(detectDeviceType(userAgent), detectOs(userAgent), brand, model,
                browserName, browserVersion, browserEngine);
    }

    private static String detectDeviceType(String userAgent) {
        if (TABLET.matcher(userAgent).find()) {
            return DeviceInfo.TABLET;
        }
        if (MOBILE.matcher(userAgent).find()) {
            return DeviceInfo.MOBILE;
        }
        return DeviceInfo.DESKTOP;
    }

    private static String detectOs(String userAgent) {
        return OS_RULES.stream()
                .filter(rule -> rule.pattern().matcher(userAgent).find())
                .map(Rule::label)
                .findFirst()
                .orElse(DeviceInfo.UNKNOWN);
    }

    private static String detectBrand(String userAgent) {
        if (userAgent.contains("iPhone") || userAgent.contains("iPad") || userAgent.contains("iPod")
                || userAgent.contains("Macintosh")) {
            return "Apple";
        }
        if (userAgent.contains("Samsung") || userAgent.contains("SM-")) {
            return "Samsung";
        }
        if (userAgent.contains("Huawei") || userAgent.contains("HUAWEI")) {
            return "Huawei";
        }
        return DeviceInfo.UNKNOWN;
    }

    private static String detectModel(String userAgent, String brand) {
        if ("Apple".equals(brand)) {
            if (userAgent.contains("iPhone")) {
                return "iPhone";
            }
            if (userAgent.contains("iPad")) {
                return "iPad";
            }
            return userAgent.contains("iPod") ? "iPod" : "Mac";
        }
        Matcher matcher = ANDROID_MODEL.matcher(userAgent);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return DeviceInfo.UNKNOWN;
    }

    private record Rule(Pattern pattern, String label) {
    }

    private record BrowserRule(Pattern pattern, String name, String engine) {
    }
}
