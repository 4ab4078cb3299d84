package com.qqsuccubus.faultlab.core.util;

import java.time.Instant;
import java.time.temporal.TemporalAccessor;

/**
 * Renders a parameterized CQL statement with its bound values inlined, for logging only.
 * <p>
 * Strings are single-quoted with embedded quotes doubled, nulls become {@code NULL}, temporal
 * values are written in ISO-8601 and anything else uses {@code toString()}. Placeholders are
 * filled left to right; surplus placeholders are left as {@code ?}.
 * </p>
 */
public final class CqlRenderer {
    private CqlRenderer() {
    }

    public static String render(String cql, Object... params) {
        if (params == null || params.length == 0) {
            return cql;
        }
        StringBuilder sb = new StringBuilder(cql.length() + 32);
        int next = 0;
        for (int i = 0; i < cql.length(); i++) {
            char c = cql.charAt(i);
            if (c == '?' && next < params.length) {
                sb.append(literal(params[next++]));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof CharSequence) {
            return "'" + value.toString().replace("'", "''") + "'";
        }
        if (value instanceof Instant || value instanceof TemporalAccessor) {
            return "'" + value + "'";
        }
        return value.toString();
    }
}
