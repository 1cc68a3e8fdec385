package io.github.hotbrkm.campaignengine.agent.email.domain;

import java.util.regex.Pattern;

public final class EmailAddressUtil {
    /**
     * Label used when email/domain is determined to be invalid
     */
    public static final String INVALID = "INVALID";

    private static final Pattern LOCAL_PART = Pattern.compile("^[A-Za-z0-9!#$%&'*+/=?^_`{|}~.-]{1,64}$");

    private EmailAddressUtil() {}

    /**
     * Accepts a bare {@code local@domain} address with a dotted, resolvable-looking domain.
     * Display names and angle brackets are rejected, since recipients come from the subscriber store bare.
     */
    public static boolean isValid(String email) {
        if (email == null) {
            return false;
        }
        String addr = email.trim();
        int at = addr.lastIndexOf('@');
        if (at <= 0 || addr.indexOf('<') >= 0 || addr.indexOf('>') >= 0) {
            return false;
        }
        String local = addr.substring(0, at);
        if (!LOCAL_PART.matcher(local).matches() || local.startsWith(".") || local.endsWith(".") || local.contains("..")) {
            return false;
        }
        String domain = extractDomain(addr);
        return !INVALID.equals(domain) && domain.indexOf('.') > 0 && !domain.contains("..");
    }

    public static String extractDomain(String email) {
        if (email == null) {
            return INVALID;
        }
        String addr = email.trim();
        if (addr.isEmpty()) {
            return INVALID;
        }

        int lt = addr.indexOf('<');
        int gt = addr.indexOf('>');
        if (lt >= 0 && gt > lt) {
            addr = addr.substring(lt + 1, gt).trim();
        }

        int at = addr.lastIndexOf('@');
        if (at <= 0 || at >= addr.length() - 1) {
            return INVALID;
        }
        String dom = addr.substring(at + 1).trim();
        if (dom.isEmpty() || dom.charAt(0) == '[') {
            return INVALID;
        }
        if (dom.endsWith(".")) {
            dom = dom.substring(0, dom.length() - 1);
        }

        String asciiDom;
        try {
            asciiDom = java.net.IDN.toASCII(dom);
        } catch (Exception e) {
            return INVALID;
        }

        for (char c : asciiDom.toCharArray()) {
            if (!(Character.isLetterOrDigit(c) || c == '-' || c == '.')) {
                return INVALID;
            }
        }
        if (asciiDom.length() <= 2) {
            return INVALID;
        }

        return asciiDom.toLowerCase();
    }
}
