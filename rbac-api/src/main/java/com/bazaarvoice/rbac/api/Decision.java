package com.bazaarvoice.rbac.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Result of a permission check.  A decision is one of granted, denied or error, always with a reason.  Callers
 * must treat anything other than {@link DecisionOutcome#GRANTED} as a denial; {@link #isGranted()} is the only
 * test that should gate access.
 */
// granted and outcome are derived from the reason, written for readers but never read back
@JsonIgnoreProperties(value = {"granted", "outcome"}, allowGetters = true)
public final class Decision {

    private final DecisionReason _reason;
    private final long _latencyMs;
    private final boolean _cacheHit;

    @JsonCreator
    public Decision(@JsonProperty("reason") DecisionReason reason,
                    @JsonProperty("latencyMs") long latencyMs,
                    @JsonProperty("cacheHit") boolean cacheHit) {
        _reason = checkNotNull(reason, "reason");
        checkArgument(latencyMs >= 0, "Latency cannot be negative");
        _latencyMs = latencyMs;
        _cacheHit = cacheHit;
    }

    public static Decision granted(DecisionReason reason) {
        checkArgument(reason.getOutcome() == DecisionOutcome.GRANTED, "Not a grant reason: %s", reason);
        return new Decision(reason, 0, false);
    }

    public static Decision denied(DecisionReason reason) {
        checkArgument(reason.getOutcome() == DecisionOutcome.DENIED, "Not a denial reason: %s", reason);
        return new Decision(reason, 0, false);
    }

    public static Decision error(DecisionReason reason) {
        checkArgument(reason.getOutcome() == DecisionOutcome.ERROR, "Not an error reason: %s", reason);
        return new Decision(reason, 0, false);
    }

    /** Returns a copy of this decision stamped with the observed latency and cache-hit flag. */
    public Decision withTiming(long latencyMs, boolean cacheHit) {
        return new Decision(_reason, latencyMs, cacheHit);
    }

    public boolean isGranted() {
        return getOutcome() == DecisionOutcome.GRANTED;
    }

    public DecisionOutcome getOutcome() {
        return _reason.getOutcome();
    }

    public DecisionReason getReason() {
        return _reason;
    }

    public long getLatencyMs() {
        return _latencyMs;
    }

    public boolean isCacheHit() {
        return _cacheHit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Decision)) {
            return false;
        }
        Decision that = (Decision) o;
        return _reason == that._reason &&
                _latencyMs == that._latencyMs &&
                _cacheHit == that._cacheHit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(_reason, _latencyMs, _cacheHit);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("outcome", getOutcome())
                .add("reason", _reason)
                .add("latencyMs", _latencyMs)
                .add("cacheHit", _cacheHit)
                .toString();
    }
}
