package com.questrail.central.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly for event timestamps.
 *
 * <p>MUST NOT be used for deadlines.</p>
 */
public interface WallClock
{
    Instant now();
}
