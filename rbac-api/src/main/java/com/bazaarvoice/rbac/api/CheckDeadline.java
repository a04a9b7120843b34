package com.bazaarvoice.rbac.api;

import com.google.common.base.MoreObjects;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Deadline and cancellation token for a single check.  A deadline is expired once the clock passes its instant or
 * once {@link #cancel()} is called, whichever comes first.
 */
public class CheckDeadline {

    private final Clock _clock;
    private final Instant _expiresAt;
    private volatile boolean _cancelled;

    public CheckDeadline(Clock clock, Instant expiresAt) {
        _clock = checkNotNull(clock, "clock");
        _expiresAt = checkNotNull(expiresAt, "expiresAt");
    }

    public static CheckDeadline after(Clock clock, Duration timeout) {
        checkNotNull(timeout, "timeout");
        checkArgument(!timeout.isNegative(), "Timeout cannot be negative");
        return new CheckDeadline(clock, clock.instant().plus(timeout));
    }

    public void cancel() {
        _cancelled = true;
    }

    public boolean isCancelled() {
        return _cancelled;
    }

    public boolean isExpired() {
        return _cancelled || !_clock.instant().isBefore(_expiresAt);
    }

    /** Milliseconds left before expiry, zero if already expired or cancelled. */
    public long remainingMillis() {
        if (_cancelled) {
            return 0;
        }
        return Math.max(0, _expiresAt.toEpochMilli() - _clock.millis());
    }

    public Instant getExpiresAt() {
        return _expiresAt;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("expiresAt", _expiresAt)
                .add("cancelled", _cancelled)
                .toString();
    }
}
