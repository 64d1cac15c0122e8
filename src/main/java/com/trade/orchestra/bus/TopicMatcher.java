package com.trade.orchestra.bus;

import com.trade.orchestra.common.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Dot-separated topic patterns.
 * <ul>
 *   <li>{@code *} matches exactly one segment</li>
 *   <li>{@code >} matches whatever remains of the topic, including nothing, and may only appear last</li>
 * </ul>
 * A {@code *} past the end of the topic still counts as matched; only a literal segment needs
 * a topic segment to compare with.
 */
public final class TopicMatcher {

    private TopicMatcher() {
    }

    public static boolean matches(String topic, String pattern) {
        if (topic == null || pattern == null) return false;
        String[] t = topic.split("\\.", -1);
        String[] p = pattern.split("\\.", -1);

        for (int i = 0; i < p.length; i++) {
            String seg = p[i];
            if (">".equals(seg)) return true;
            if ("*".equals(seg)) continue;
            if (i >= t.length || !seg.equals(t[i])) return false;
        }
        return t.length == p.length;
    }

    /**
     * @throws ValidationException when the pattern is blank, has an empty segment, or {@code >} is not last
     */
    public static String validate(String pattern) {
        if (pattern == null || pattern.trim().isEmpty()) {
            throw new ValidationException("Topic pattern must not be blank");
        }
        String[] p = pattern.split("\\.", -1);
        for (int i = 0; i < p.length; i++) {
            if (p[i].isEmpty()) {
                throw new ValidationException("Topic pattern '" + pattern + "' has an empty segment");
            }
            if (">".equals(p[i]) && i != p.length - 1) {
                throw new ValidationException("'>' must be the last segment of '" + pattern + "'");
            }
        }
        return pattern;
    }

    /**
     * Same semantics as {@link #matches}, as an anchored regex over Kafka topic names.
     */
    public static Pattern toRegex(String pattern) {
        validate(pattern);
        String[] p = pattern.split("\\.", -1);
        if (!">".equals(p[p.length - 1])) {
            StringBuilder sb = new StringBuilder("^");
            for (int i = 0; i < p.length; i++) {
                if (i > 0) sb.append("\\.");
                sb.append(segmentRegex(p[i]));
            }
            return Pattern.compile(sb.append('$').toString());
        }

        // the topic only has to reach the last literal before '>'
        int lastLiteral = -1;
        for (int i = 0; i < p.length - 1; i++) {
            if (!"*".equals(p[i])) lastLiteral = i;
        }
        if (lastLiteral < 0) return Pattern.compile("^.*$");
        StringBuilder sb = new StringBuilder("^");
        for (int i = 0; i <= lastLiteral; i++) {
            if (i > 0) sb.append("\\.");
            sb.append(segmentRegex(p[i]));
        }
        return Pattern.compile(sb.append("(\\..*)?$").toString());
    }

    private static String segmentRegex(String seg) {
        return "*".equals(seg) ? "[^.]*" : Pattern.quote(seg);
    }
}
