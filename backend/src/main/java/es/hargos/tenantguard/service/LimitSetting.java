package es.hargos.tenantguard.service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * One configured quota value in one of three states: absent (defer to the next
 * source), unlimited (explicit null) or a positive ceiling.
 *
 * Configuration input is permissive: anything that is not a positive integer or
 * an explicit null normalizes to {@link #ABSENT} instead of failing.
 */
public final class LimitSetting {

    public static final LimitSetting ABSENT = new LimitSetting(false, null);
    public static final LimitSetting UNLIMITED = new LimitSetting(true, null);

    private final boolean present;
    private final Integer value;

    private LimitSetting(boolean present, Integer value) {
        this.present = present;
        this.value = value;
    }

    public static LimitSetting of(int ceiling) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("Limit must be a positive integer, got " + ceiling);
        }
        return new LimitSetting(true, ceiling);
    }

    /**
     * Nullable ceiling as stored in a column: null means unlimited.
     */
    public static LimitSetting ofNullable(Integer ceiling) {
        if (ceiling == null) {
            return UNLIMITED;
        }
        return ceiling >= 1 ? of(ceiling) : ABSENT;
    }

    /**
     * @param raw a value read from JSON: null, a number, or anything else
     */
    public static LimitSetting normalize(Object raw) {
        if (raw == null) {
            return UNLIMITED;
        }
        if (!(raw instanceof Number)) {
            return ABSENT;
        }
        BigDecimal decimal;
        try {
            decimal = new BigDecimal(raw.toString());
        } catch (NumberFormatException e) {
            // NaN and infinities
            return ABSENT;
        }
        if (decimal.signum() <= 0 || decimal.stripTrailingZeros().scale() > 0) {
            return ABSENT;
        }
        if (decimal.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
            return ABSENT;
        }
        return of(decimal.intValueExact());
    }

    /**
     * Reads the first of the given keys that the map contains. A missing map or
     * missing keys yield {@link #ABSENT}; an explicit null yields {@link #UNLIMITED}.
     */
    public static LimitSetting fromMap(Map<String, ?> source, String... keys) {
        if (source == null) {
            return ABSENT;
        }
        for (String key : keys) {
            if (source.containsKey(key)) {
                return normalize(source.get(key));
            }
        }
        return ABSENT;
    }

    /**
     * Prioritized resolution: the first present setting wins.
     *
     * @return the ceiling, or null for unlimited (also when every source is absent)
     */
    public static Integer resolve(LimitSetting override, LimitSetting tierDefault, LimitSetting fallback) {
        return override.or(tierDefault).or(fallback).toLimit();
    }

    public LimitSetting or(LimitSetting other) {
        return present ? this : other;
    }

    public boolean isPresent() {
        return present;
    }

    public boolean isUnlimited() {
        return present && value == null;
    }

    /**
     * @return the ceiling, or null when unlimited or absent
     */
    public Integer toLimit() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LimitSetting)) return false;
        LimitSetting that = (LimitSetting) o;
        return present == that.present && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        if (!present) return "LimitSetting[absent]";
        return value == null ? "LimitSetting[unlimited]" : "LimitSetting[" + value + "]";
    }
}
