package com.bazaarvoice.rbac.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Thrown when a check request is malformed, for example a missing user or tenant.  This is a caller error and is
 * never reported as a denial.
 */
@JsonIgnoreProperties({"cause", "localizedMessage", "stackTrace"})
public class InvalidCheckRequestException extends IllegalArgumentException {

    public InvalidCheckRequestException(String message) {
        super(message);
    }

    public InvalidCheckRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
