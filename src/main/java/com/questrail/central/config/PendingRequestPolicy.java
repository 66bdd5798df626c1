package com.questrail.central.config;

/**
 * What happens to pending connect and disconnect requests when the radio
 * leaves {@code POWERED_ON}.
 *
 * <p>The active scan is always stopped on readiness loss; this policy only
 * governs per-peripheral requests.</p>
 */
public enum PendingRequestPolicy
{
    /**
     * Leave pending requests alone; each resolves through a late notification
     * or its own deadline.
     */
    AWAIT_DEADLINE,

    /**
     * Resolve every pending request at once with {@code ReadinessLost}.
     */
    FAIL_FAST
}
