package quest.gekko.searchvolume.domain;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Access tier of a subscription. An HOURLY subscription also grants DAILY access
 * for the same dates, a DAILY subscription never grants HOURLY access.
 */
public enum Capability {
    HOURLY,
    DAILY;

    private static final Map<Capability, Set<Capability>> IMPLIES = new EnumMap<>(Capability.class);

    static {
        IMPLIES.put(HOURLY, EnumSet.of(HOURLY, DAILY));
        IMPLIES.put(DAILY, EnumSet.of(DAILY));
    }

    /**
     * @return true if holding this capability is enough to be served {@code requested}
     */
    public boolean implies(final Capability requested) {
        return IMPLIES.get(this).contains(requested);
    }

    public static boolean isSupported(final String value) {
        for (Capability c : values()) {
            if (c.name().equals(value)) return true;
        }
        return false;
    }
}
