package io.github.hotbrkm.campaignengine.agent.email.content;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {a|b|c}} dynamic-content blocks.
 * <p>
 * Rules:
 * <ol>
 *   <li>Blocks resolve innermost first, one pass per nesting level, each block drawing independently.</li>
 *   <li>Nesting is bounded by {@code maxDepth}; deeper input fails instead of being partially expanded.</li>
 *   <li>Personalization placeholders such as {@code {{first_name}}} are not blocks and pass through untouched.</li>
 *   <li>A brace pair without a {@code |} at its own level is literal text, so CSS rules survive expansion.</li>
 *   <li>Unbalanced braces, empty options and all-zero weights at any level are validation errors.</li>
 * </ol>
 * Instances are stateless and safe to share; randomness is supplied per call.
 */
@Slf4j
public class SpintaxExpander {

    public static final int DEFAULT_MAX_DEPTH = 10;

    private static final Pattern INNERMOST_BLOCK = Pattern.compile("\\{([^{}]*)\\}");
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*[A-Za-z0-9_]+\\s*\\}\\}");
    private static final Pattern WEIGHTED_OPTION = Pattern.compile("^(.*):(\\d+)$", Pattern.DOTALL);
    private static final char MASK_START = '\u0001';
    private static final char MASK_END = '\u0002';
    private static final Pattern MASKED = Pattern.compile(MASK_START + "(\\d+)" + MASK_END);
    private static final char LITERAL_OPEN = '\u0003';
    private static final char LITERAL_CLOSE = '\u0004';

    private final int maxDepth;

    public SpintaxExpander() {
        this(DEFAULT_MAX_DEPTH);
    }

    public SpintaxExpander(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public String expand(String text) {
        return expand(text, ThreadLocalRandom.current());
    }

    /**
     * Picks one option per block, uniformly.
     *
     * @throws SpintaxSyntaxException when the text fails {@link #validate(String)}
     */
    public String expand(String text, RandomGenerator random) {
        return resolve(text, random, false);
    }

    public String expandWeighted(String text) {
        return expandWeighted(text, ThreadLocalRandom.current());
    }

    /**
     * Picks one option per block with probability proportional to its {@code :weight} suffix (default 1).
     */
    public String expandWeighted(String text, RandomGenerator random) {
        return resolve(text, random, true);
    }

    /**
     * Counts distinct expansion paths without expanding. Flat blocks multiply, nested options add up.
     * Saturates at {@link Long#MAX_VALUE}.
     */
    public long countVariations(String text) {
        if (text == null || text.isEmpty()) {
            return 1;
        }
        throwIfInvalid(text);
        Masked masked = mask(text);
        return countSequence(masked.text(), new int[]{0}, false);
    }

    /**
     * Returns every syntax problem in the text. An empty list means the text expands cleanly.
     */
    public List<String> validate(String text) {
        List<String> errors = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return errors;
        }
        String masked = mask(text).text();

        int open = 0;
        int close = 0;
        int depth = 0;
        int deepest = 0;
        boolean closedBeforeOpen = false;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '{') {
                open++;
                depth++;
                deepest = Math.max(deepest, depth);
            } else if (c == '}') {
                close++;
                depth--;
                if (depth < 0) {
                    closedBeforeOpen = true;
                    depth = 0;
                }
            }
        }
        if (open != close) {
            errors.add("Mismatched braces: " + open + " opening, " + close + " closing");
        } else if (closedBeforeOpen) {
            errors.add("Closing brace without a matching opening brace");
        }
        if (masked.contains("{|") || masked.contains("||") || masked.contains("|}")) {
            errors.add("Empty spintax options found");
        }
        if (deepest > maxDepth) {
            errors.add("Spintax nesting too deep: " + deepest + " levels (max: " + maxDepth + ")");
        }
        if (errors.isEmpty()) {
            for (String block : blocks(masked)) {
                List<String> options = splitOptions(block);
                if (options.size() > 1 && hasOnlyZeroWeights(options)) {
                    errors.add("All options have zero weight: {" + block + "}");
                }
            }
        }
        return errors;
    }

    /**
     * Draws {@code count} expansions and keeps the distinct ones, in draw order.
     */
    public List<String> generateVariations(String text, int count, RandomGenerator random) {
        Set<String> variations = new LinkedHashSet<>();
        for (int i = 0; i < count; i++) {
            variations.add(expand(text, random));
        }
        return new ArrayList<>(variations);
    }

    private String resolve(String text, RandomGenerator random, boolean weighted) {
        if (text == null || text.indexOf('{') < 0) {
            return text;
        }
        throwIfInvalid(text);

        Masked masked = mask(text);
        String current = masked.text();
        int depth = 0;
        while (INNERMOST_BLOCK.matcher(current).find()) {
            if (++depth > maxDepth) {
                throw new SpintaxSyntaxException("Spintax nesting exceeds max depth " + maxDepth);
            }
            Matcher matcher = INNERMOST_BLOCK.matcher(current);
            StringBuilder sb = new StringBuilder(current.length());
            while (matcher.find()) {
                String body = matcher.group(1);
                String chosen;
                if (body.indexOf('|') < 0) {
                    chosen = LITERAL_OPEN + body + LITERAL_CLOSE;
                } else {
                    String[] options = body.split("\\|", -1);
                    chosen = weighted ? pickWeighted(options, random) : options[random.nextInt(options.length)];
                }
                matcher.appendReplacement(sb, Matcher.quoteReplacement(chosen));
            }
            matcher.appendTail(sb);
            current = sb.toString();
        }
        current = current.replace(LITERAL_OPEN, '{').replace(LITERAL_CLOSE, '}');
        return masked.restore(current);
    }

    private String pickWeighted(String[] options, RandomGenerator random) {
        String[] texts = new String[options.length];
        long[] weights = new long[options.length];
        long total = 0;
        for (int i = 0; i < options.length; i++) {
            Matcher matcher = WEIGHTED_OPTION.matcher(options[i]);
            if (matcher.matches()) {
                texts[i] = matcher.group(1);
                weights[i] = parseWeight(matcher.group(2));
            } else {
                texts[i] = options[i];
                weights[i] = 1;
            }
            total = total > Long.MAX_VALUE - weights[i] ? Long.MAX_VALUE : total + weights[i];
        }
        if (total <= 0) {
            throw new SpintaxSyntaxException("All options have zero weight: {" + String.join("|", options) + "}");
        }

        long roll = random.nextLong(total);
        for (int i = 0; i < options.length; i++) {
            roll -= weights[i];
            if (roll < 0) {
                return texts[i];
            }
        }
        return texts[texts.length - 1];
    }

    private boolean hasOnlyZeroWeights(List<String> options) {
        for (String option : options) {
            Matcher matcher = WEIGHTED_OPTION.matcher(option);
            if (!matcher.matches() || parseWeight(matcher.group(2)) > 0) {
                return false;
            }
        }
        return true;
    }

    private long parseWeight(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            // more digits than a long holds
            return Long.MAX_VALUE;
        }
    }

    // Bodies of every brace pair, inner pairs before the pairs enclosing them. Braces must be balanced.
    private static List<String> blocks(String text) {
        List<String> blocks = new ArrayList<>();
        Deque<Integer> starts = new ArrayDeque<>();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                starts.push(i);
            } else if (c == '}' && !starts.isEmpty()) {
                blocks.add(text.substring(starts.pop() + 1, i));
            }
        }
        return blocks;
    }

    // Splits a block body on the pipes of its own level, leaving nested blocks whole
    private static List<String> splitOptions(String body) {
        List<String> options = new ArrayList<>();
        int depth = 0;
        int from = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == '|' && depth == 0) {
                options.add(body.substring(from, i));
                from = i + 1;
            }
        }
        options.add(body.substring(from));
        return options;
    }

    private void throwIfInvalid(String text) {
        List<String> errors = validate(text);
        if (!errors.isEmpty()) {
            log.debug("event=spintax_invalid, errors={}", errors);
            throw new SpintaxSyntaxException(errors);
        }
    }

    // sequence := (literal | block)*, cursor[0] is advanced past the consumed input
    private long countSequence(String text, int[] cursor, boolean insideBlock) {
        long total = 1;
        while (cursor[0] < text.length()) {
            char c = text.charAt(cursor[0]);
            if (insideBlock && (c == '}' || c == '|')) {
                return total;
            }
            cursor[0]++;
            if (c == '{') {
                total = saturatingMultiply(total, countBlock(text, cursor));
            }
        }
        return total;
    }

    private long countBlock(String text, int[] cursor) {
        long sum = 0;
        while (true) {
            long option = countSequence(text, cursor, true);
            sum = sum > Long.MAX_VALUE - option ? Long.MAX_VALUE : sum + option;
            char c = text.charAt(cursor[0]++);
            if (c == '}') {
                return sum;
            }
        }
    }

    private static long saturatingMultiply(long a, long b) {
        long high = Math.multiplyHigh(a, b);
        long product = a * b;
        if (high != 0 || product < 0) {
            return Long.MAX_VALUE;
        }
        return product;
    }

    private static Masked mask(String text) {
        List<String> placeholders = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        while (matcher.find()) {
            placeholders.add(matcher.group());
            matcher.appendReplacement(sb, Matcher.quoteReplacement(MASK_START + String.valueOf(placeholders.size() - 1) + MASK_END));
        }
        matcher.appendTail(sb);
        return new Masked(sb.toString(), placeholders);
    }

    private record Masked(String text, List<String> placeholders) {
        String restore(String expanded) {
            if (placeholders.isEmpty()) {
                return expanded;
            }
            Matcher matcher = MASKED.matcher(expanded);
            StringBuilder sb = new StringBuilder(expanded.length());
            while (matcher.find()) {
                String original = placeholders.get(Integer.parseInt(matcher.group(1)));
                matcher.appendReplacement(sb, Matcher.quoteReplacement(original));
            }
            matcher.appendTail(sb);
            return sb.toString();
        }
    }
}
