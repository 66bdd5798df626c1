package com.questrail.central.config;

import java.util.Objects;

/**
 * Aggregated configuration for the central runtime.
 */
public record CentralRuntimeConfig(
    CentralTimingPolicy timingPolicy,
    PendingRequestPolicy pendingRequestPolicy
) {
    public CentralRuntimeConfig {
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(pendingRequestPolicy, "pendingRequestPolicy");
    }

    public static CentralRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CentralTimingPolicy timingPolicy = CentralTimingPolicy.defaults();
        private PendingRequestPolicy pendingRequestPolicy = PendingRequestPolicy.AWAIT_DEADLINE;

        public Builder withTimingPolicy(CentralTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withPendingRequestPolicy(PendingRequestPolicy policy) {
            this.pendingRequestPolicy = policy;
            return this;
        }

        public CentralRuntimeConfig build() {
            return new CentralRuntimeConfig(timingPolicy, pendingRequestPolicy);
        }
    }
}
