package com.zero.core.cache;

import com.zero.core.model.FreshnessLevel;

import java.time.Duration;

/**
 * Classifies an artifact's age against its TTL.
 * <pre>
 *   age &lt;= ttl                        FRESH
 *   age &lt;= ttl * staleMultiplier      STALE
 *   age &lt;= ttl * veryStaleMultiplier  VERY_STALE
 *   otherwise                          EXPIRED
 * </pre>
 * A threshold too large for {@link Duration} counts as unbounded.
 */
public record FreshnessPolicy(int staleMultiplier, int veryStaleMultiplier) {

    public static final FreshnessPolicy DEFAULT = new FreshnessPolicy(7, 30);

    public FreshnessPolicy {
        if (staleMultiplier < 1 || veryStaleMultiplier < staleMultiplier) {
            throw new IllegalArgumentException("Freshness multipliers must satisfy 1 <= stale <= veryStale, got "
                    + staleMultiplier + " and " + veryStaleMultiplier);
        }
    }

    public FreshnessLevel classify(Duration age, Duration ttl) {
        if (age.compareTo(ttl) <= 0) {
            return FreshnessLevel.FRESH;
        }
        if (within(age, ttl, staleMultiplier)) {
            return FreshnessLevel.STALE;
        }
        if (within(age, ttl, veryStaleMultiplier)) {
            return FreshnessLevel.VERY_STALE;
        }
        return FreshnessLevel.EXPIRED;
    }

    /**
     * Human-readable age: "never", "less than an hour ago", then hours, days,
     * weeks and months.
     */
    public static String describeAge(Duration age) {
        if (age == null) {
            return "never";
        }
        long hours = age.toHours();
        if (hours < 1) {
            return "less than an hour ago";
        }
        if (hours < 24) {
            return plural(hours, "hour");
        }
        long days = hours / 24;
        if (days < 7) {
            return plural(days, "day");
        }
        long weeks = days / 7;
        if (weeks < 4) {
            return plural(weeks, "week");
        }
        return plural(days / 30 == 0 ? 1 : days / 30, "month");
    }

    private static boolean within(Duration age, Duration ttl, int multiplier) {
        try {
            return age.compareTo(ttl.multipliedBy(multiplier)) <= 0;
        } catch (ArithmeticException e) {
            return true;
        }
    }

    private static String plural(long n, String unit) {
        return n + " " + unit + (n == 1 ? "" : "s") + " ago";
    }
}
