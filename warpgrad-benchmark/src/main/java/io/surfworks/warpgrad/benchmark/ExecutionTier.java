package io.surfworks.warpgrad.benchmark;

/**
 * How a training step is executed.
 *
 * <ul>
 *   <li>{@link #DEFINE_BY_RUN} - the graph is rebuilt on every call (baseline)</li>
 *   <li>{@link #STATIC_SCHEDULE} - the region is traced once and replayed afterwards</li>
 * </ul>
 */
public enum ExecutionTier {

    DEFINE_BY_RUN("dbr"),

    STATIC_SCHEDULE("static");

    private final String shortName;

    ExecutionTier(String shortName) {
        this.shortName = shortName;
    }

    /**
     * Short identifier used on the command line and in reports.
     */
    public String shortName() {
        return shortName;
    }

    /**
     * Parses a tier from its short name or enum name, ignoring case.
     *
     * @throws IllegalArgumentException for an unknown tier
     */
    public static ExecutionTier parse(String value) {
        for (ExecutionTier tier : values()) {
            if (tier.shortName.equalsIgnoreCase(value) || tier.name().equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown execution tier: " + value);
    }
}
