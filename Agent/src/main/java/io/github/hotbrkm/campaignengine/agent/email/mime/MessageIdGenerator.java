package io.github.hotbrkm.campaignengine.agent.email.mime;

import java.net.InetAddress;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicLong;
import lombok.experimental.UtilityClass;

/**
 * Message-ID values of the form {@code <millis.counter.node@domain>}. The node part is random per process so ids
 * from parallel instances do not collide within the same millisecond.
 */
@UtilityClass
public class MessageIdGenerator {
    private static final AtomicLong INDEX = new AtomicLong(0);
    private static final String NODE = HexFormat.of().formatHex(new SecureRandom().generateSeed(4));
    private static volatile String hostName;

    public static String next(String domain) {
        long nextIndex = INDEX.updateAndGet(i -> (i + 1) % 10000000L);
        String scope = domain == null || domain.isBlank() ? getHostName() : domain.trim().toLowerCase();
        return "<" + System.currentTimeMillis() + "." + nextIndex + "." + NODE + "@" + scope + ">";
    }

    private static String getHostName() {
        String cached = hostName;
        if (cached != null) {
            return cached;
        }
        synchronized (MessageIdGenerator.class) {
            if (hostName != null) {
                return hostName;
            }
            try {
                hostName = InetAddress.getLocalHost().getHostName();
            } catch (Exception e) {
                hostName = "127.0.0.1";
            }
            return hostName;
        }
    }
}
