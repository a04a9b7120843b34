package com.bazaarvoice.rbac.resolver;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Outcome of asking whether a user may grant a permission to someone else.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GrantValidation {

    private static final GrantValidation VALID = new GrantValidation(true, null);

    private final boolean _valid;
    private final String _reason;

    @JsonCreator
    private GrantValidation(@JsonProperty("valid") boolean valid, @JsonProperty("reason") @Nullable String reason) {
        _valid = valid;
        _reason = reason;
    }

    public static GrantValidation valid() {
        return VALID;
    }

    public static GrantValidation invalid(String reason) {
        return new GrantValidation(false, checkNotNull(reason, "reason"));
    }

    public boolean isValid() {
        return _valid;
    }

    @Nullable
    public String getReason() {
        return _reason;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("valid", _valid)
                .add("reason", _reason)
                .toString();
    }
}
