package com.pgschema.core.query;

/**
 * Immutable settings for {@link CollectionQueryEngine}.
 * <pre>
 *   EngineConfig config = EngineConfig.builder()
 *       .restrictionMode(RestrictionMode.STRICT)
 *       .build();
 * </pre>
 */
public final class EngineConfig {

    private static final EngineConfig DEFAULTS = builder().build();

    private final RestrictionMode restrictionMode;

    private EngineConfig(Builder b) {
        this.restrictionMode = b.restrictionMode;
    }

    public RestrictionMode getRestrictionMode() { return restrictionMode; }

    public static EngineConfig defaults() { return DEFAULTS; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private RestrictionMode restrictionMode = RestrictionMode.PERMISSIVE;

        public Builder restrictionMode(RestrictionMode mode) { this.restrictionMode = mode; return this; }

        public EngineConfig build() {
            if (restrictionMode == null) {
                throw new IllegalStateException("restrictionMode is required");
            }
            return new EngineConfig(this);
        }
    }
}
