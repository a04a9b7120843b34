package com.bazaarvoice.rbac.time;

import com.google.common.base.Ticker;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Guava {@link Ticker} driven by a {@link Clock}, so cache expiration and decision timestamps follow one timeline.
 * Tests which move a clock forward therefore also expire cache entries.  Resolution is one millisecond.
 */
public final class ClockTicker extends Ticker {

    private static final ClockTicker SYSTEM_UTC = new ClockTicker(Clock.systemUTC());

    private final Clock _clock;

    private ClockTicker(Clock clock) {
        _clock = checkNotNull(clock, "clock");
    }

    public static Ticker of(Clock clock) {
        return Clock.systemUTC().equals(clock) ? SYSTEM_UTC : new ClockTicker(clock);
    }

    @Override
    public long read() {
        return TimeUnit.MILLISECONDS.toNanos(_clock.millis());
    }
}
