package io.github.hotbrkm.campaignengine.server.attribution;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Picks the client IP of a tracking hit. Proxy headers are trusted only when they carry a public address;
 * otherwise the socket address is used.
 */
@Component
public class ClientIpResolver {

    static final String UNKNOWN_IP = "0.0.0.0";

    private static final List<String> HEADERS = List.of(
            "CF-Connecting-IP",
            "X-Client-IP",
            "X-Forwarded-For",
            "X-Cluster-Client-IP");

    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:.]+$");

    public String resolve(HttpServletRequest request) {
        for (String header : HEADERS) {
            String value = request.getHeader(header);
            if (value == null || value.isBlank()) {
                continue;
            }
            // X-Forwarded-For lists the client first
            String candidate = value.split(",")[0].trim();
            if (isPublicAddress(candidate)) {
                return candidate;
            }
        }
        String remote = request.getRemoteAddr();
        return remote != null && !remote.isBlank() ? remote : UNKNOWN_IP;
    }

    static boolean isPublicAddress(String candidate) {
        if (!isIpLiteral(candidate)) {
            return false;
        }
        try {
            InetAddress address = InetAddress.getByName(candidate);
            return !(address.isAnyLocalAddress()
                    || address.isLoopbackAddress()
                    || address.isLinkLocalAddress()
                    || address.isSiteLocalAddress()
                    || address.isMulticastAddress());
        } catch (UnknownHostException e) {
            return false;
        }
    }

    private static boolean isIpLiteral(String candidate) {
        if (IPV4.matcher(candidate).matches()) {
            return true;
        }
        return candidate.contains(":") && IPV6.matcher(candidate).matches();
    }
}
