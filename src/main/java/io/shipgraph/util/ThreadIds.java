package io.shipgraph.util;

import java.util.regex.Pattern;

public final class ThreadIds {
    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    private ThreadIds() {
    }

    public static boolean isValid(String threadId) {
        return threadId != null
                && VALID.matcher(threadId).matches()
                && !".".equals(threadId)
                && !"..".equals(threadId);
    }

    public static String require(String threadId) {
        if (!isValid(threadId)) {
            throw new IllegalArgumentException("Invalid thread id: " + threadId);
        }
        return threadId;
    }
}
