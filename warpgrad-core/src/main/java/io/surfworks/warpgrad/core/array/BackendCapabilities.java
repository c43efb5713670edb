package io.surfworks.warpgrad.core.array;

import java.util.Set;

/**
 * Describes the capabilities of an array backend.
 */
public record BackendCapabilities(
    Set<ScalarType> supportedDtypes,
    boolean supportsAsync,
    boolean supportsInPlaceCopy,
    int maxTensorRank,
    long maxElementCount
) {
    /**
     * Default capabilities for the reference CPU backend.
     */
    public static BackendCapabilities cpu() {
        return new BackendCapabilities(
            Set.of(ScalarType.F32, ScalarType.F64, ScalarType.I32, ScalarType.I64, ScalarType.BOOL),
            false, // synchronous
            true,
            8,
            Integer.MAX_VALUE
        );
    }

    public boolean supports(ScalarType dtype) {
        return supportedDtypes.contains(dtype);
    }

    /**
     * Builder for custom capabilities.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<ScalarType> dtypes = Set.of(ScalarType.F32);
        private boolean async = false;
        private boolean inPlaceCopy = true;
        private int maxRank = 8;
        private long maxElements = Integer.MAX_VALUE;

        public Builder supportedDtypes(Set<ScalarType> dtypes) {
            this.dtypes = dtypes;
            return this;
        }

        public Builder supportsAsync(boolean supports) {
            this.async = supports;
            return this;
        }

        public Builder supportsInPlaceCopy(boolean supports) {
            this.inPlaceCopy = supports;
            return this;
        }

        public Builder maxTensorRank(int maxRank) {
            this.maxRank = maxRank;
            return this;
        }

        public Builder maxElementCount(long maxElements) {
            this.maxElements = maxElements;
            return this;
        }

        public BackendCapabilities build() {
            return new BackendCapabilities(dtypes, async, inPlaceCopy, maxRank, maxElements);
        }
    }
}
