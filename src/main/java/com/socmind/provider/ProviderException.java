package com.socmind.provider;

import com.socmind.core.model.ProviderFailure;

/**
 * Base class for classified provider failures.
 */
public abstract class ProviderException extends RuntimeException {

    protected ProviderException(String message) {
        super(message);
    }

    protected ProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ProviderFailure failure();
}
