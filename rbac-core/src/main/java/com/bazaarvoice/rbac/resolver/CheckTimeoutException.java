package com.bazaarvoice.rbac.resolver;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Thrown internally when a check's deadline expires or the check is cancelled while waiting on the store.
 */
@JsonIgnoreProperties({"cause", "localizedMessage", "stackTrace"})
public class CheckTimeoutException extends RuntimeException {

    public CheckTimeoutException(String message) {
        super(message);
    }
}
