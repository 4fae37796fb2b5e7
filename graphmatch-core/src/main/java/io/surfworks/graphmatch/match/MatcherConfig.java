package io.surfworks.graphmatch.match;

/**
 * Switches for the default node comparison used by {@link PatternMatcher}.
 *
 * <p>Every value can be overridden from system properties, see
 * {@link #fromSystemProperties()}.
 *
 * @param skipOpType do not compare operator types
 * @param skipDomainAndVersion do not compare operator domains and versions
 * @param strictDerivedFanOut require target fan-out to equal, rather than reach,
 *        the out-degree of pattern nodes that derive their fan-out from the pattern
 */
public record MatcherConfig(
        boolean skipOpType,
        boolean skipDomainAndVersion,
        boolean strictDerivedFanOut
) {

    public static final String PROPERTY_SKIP_OP_TYPE = "graphmatch.skipOpType";
    public static final String PROPERTY_SKIP_DOMAIN_AND_VERSION = "graphmatch.skipDomainAndVersion";
    public static final String PROPERTY_STRICT_DERIVED_FAN_OUT = "graphmatch.strictDerivedFanOut";

    /**
     * Every check enabled, lenient derived fan-out.
     */
    public static MatcherConfig defaults() {
        return new MatcherConfig(false, false, false);
    }

    /**
     * Starts from {@link #defaults()} and applies any of the
     * {@code graphmatch.*} system properties that are set.
     */
    public static MatcherConfig fromSystemProperties() {
        MatcherConfig defaults = defaults();
        return new MatcherConfig(
                booleanProperty(PROPERTY_SKIP_OP_TYPE, defaults.skipOpType()),
                booleanProperty(PROPERTY_SKIP_DOMAIN_AND_VERSION, defaults.skipDomainAndVersion()),
                booleanProperty(PROPERTY_STRICT_DERIVED_FAN_OUT, defaults.strictDerivedFanOut())
        );
    }

    public MatcherConfig withSkipOpType(boolean skip) {
        return new MatcherConfig(skip, skipDomainAndVersion, strictDerivedFanOut);
    }

    public MatcherConfig withSkipDomainAndVersion(boolean skip) {
        return new MatcherConfig(skipOpType, skip, strictDerivedFanOut);
    }

    public MatcherConfig withStrictDerivedFanOut(boolean strict) {
        return new MatcherConfig(skipOpType, skipDomainAndVersion, strict);
    }

    private static boolean booleanProperty(String key, boolean fallback) {
        String value = System.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }
}
