package com.questrail.gateway.broker.internal;

import java.nio.charset.StandardCharsets;

/**
 * MQTT topic name and topic filter rules.
 */
public final class TopicNames
{
    static final int MAX_LENGTH = 65535;

    private TopicNames() {}

    /**
     * @return {@code null} if the name is a valid topic name for a
     *         publication, otherwise the reason it is not
     */
    public static String validateName(String name) {
        String common = validateCommon(name);
        if (common != null) {
            return common;
        }
        if (name.indexOf('+') != -1 || name.indexOf('#') != -1) {
            return "wildcards are not allowed in topic names";
        }
        return null;
    }

    /**
     * @return {@code null} if the filter is a valid subscription filter,
     *         otherwise the reason it is not
     */
    public static String validateFilter(String filter) {
        String common = validateCommon(filter);
        if (common != null) {
            return common;
        }
        String[] levels = filter.split("/", -1);
        for (int i = 0; i < levels.length; i++) {
            String level = levels[i];
            if (level.indexOf('#') != -1 && (!level.equals("#") || i != levels.length - 1)) {
                return "'#' must occupy the last level";
            }
            if (level.indexOf('+') != -1 && !level.equals("+")) {
                return "'+' must occupy an entire level";
            }
        }
        return null;
    }

    /**
     * Whether the topic name matches the filter. Both are assumed valid.
     * Topics starting with {@code $} are not matched by filters starting with
     * a wildcard.
     */
    public static boolean matches(String filter, String topic) {
        if (topic.startsWith("$") && (filter.startsWith("+") || filter.startsWith("#"))) {
            return false;
        }
        String[] f = filter.split("/", -1);
        String[] t = topic.split("/", -1);

        int i = 0;
        for (; i < f.length; i++) {
            if (f[i].equals("#")) {
                return true;
            }
            if (i >= t.length) {
                return false;
            }
            if (!f[i].equals("+") && !f[i].equals(t[i])) {
                return false;
            }
        }
        return i == t.length;
    }

    private static String validateCommon(String s) {
        if (s == null || s.isEmpty()) {
            return "empty topic";
        }
        if (s.indexOf('\u0000') != -1) {
            return "NUL character in topic";
        }
        if (s.getBytes(StandardCharsets.UTF_8).length > MAX_LENGTH) {
            return "topic too long";
        }
        return null;
    }
}
