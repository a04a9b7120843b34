package com.bazaarvoice.rbac.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Thrown by a {@link PermissionStore} when it cannot be reached or fails to answer.
 */
@JsonIgnoreProperties({"cause", "localizedMessage", "stackTrace"})
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
