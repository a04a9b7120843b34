package com.bazaarvoice.rbac.dependency;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Thrown when a dependency rule table cannot be loaded because it is malformed or contains a cycle.  A table which
 * raises this exception is never used for a check.
 */
@JsonIgnoreProperties({"cause", "localizedMessage", "stackTrace"})
public class DependencyConfigurationException extends RuntimeException {

    public DependencyConfigurationException(String message) {
        super(message);
    }
}
