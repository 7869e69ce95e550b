package io.quirrel.storage;

import io.quirrel.util.Hashing;

/**
 * Derived entry names. A route owns at most one recurring entry ({@code cron-job:<route>}) plus any
 * number of id'd entries ({@code job:<route>:<id>}).
 *
 * <p>Routes never contain {@code :}, so the first colon after {@code job:} separates route from id
 * and ids may contain colons of their own.
 *
 * <p>Names are bounded to {@link #MAX_LENGTH} characters, the identifier limit of the backing
 * stores. Longer names keep a readable prefix and end in {@code ~} plus a hash of the full name, so
 * two long names that share a prefix still map to different entries.
 */
public final class JobNames {
    public static final int MAX_LENGTH = 64;
    public static final String CRON_ID = "@cron";
    public static final String CRON_PREFIX = "cron-job:";
    public static final String JOB_PREFIX = "job:";
    private static final int HASH_CHARS = 12;

    private JobNames() {
    }

    public static String cron(String route) {
        return bound(CRON_PREFIX + requireRoute(route));
    }

    public static String job(String route, String id) {
        return bound(JOB_PREFIX + requireRoute(route) + ":" + id);
    }

    /**
     * @throws IllegalArgumentException if the route is blank or contains {@code :}
     */
    public static String requireRoute(String route) {
        if (route == null || route.isBlank()) {
            throw new IllegalArgumentException("route is required");
        }
        if (route.indexOf(':') >= 0) {
            throw new IllegalArgumentException("route must not contain ':', got " + route);
        }
        return route;
    }

    public static String bound(String name) {
        if (name.length() <= MAX_LENGTH) {
            return name;
        }
        String hash = Hashing.sha256Hex(name).substring(0, HASH_CHARS);
        return name.substring(0, MAX_LENGTH - HASH_CHARS - 1) + "~" + hash;
    }

    public static boolean truncated(String name) {
        return name.length() == MAX_LENGTH && name.charAt(MAX_LENGTH - HASH_CHARS - 1) == '~';
    }

    /**
     * Recovers route and external id from a name. Truncated names yield null parts.
     */
    public static Parsed parse(String name) {
        if (name == null || truncated(name)) {
            return new Parsed(null, null);
        }
        if (name.startsWith(CRON_PREFIX)) {
            return new Parsed(name.substring(CRON_PREFIX.length()), CRON_ID);
        }
        if (name.startsWith(JOB_PREFIX)) {
            String rest = name.substring(JOB_PREFIX.length());
            int colon = rest.indexOf(':');
            if (colon > 0) {
                return new Parsed(rest.substring(0, colon), rest.substring(colon + 1));
            }
        }
        return new Parsed(null, null);
    }

    /**
     * SQL {@code LIKE} pattern (escape character {@code \}) matching every id'd entry of a route.
     */
    static String jobLikePattern(String route) {
        return escapeLike(JOB_PREFIX + route + ":") + "%";
    }

    static String escapeLike(String raw) {
        return raw.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    public record Parsed(String route, String externalId) {
    }
}
