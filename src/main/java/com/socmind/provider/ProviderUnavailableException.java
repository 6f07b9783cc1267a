package com.socmind.provider;

import com.socmind.core.model.ProviderFailure;

public class ProviderUnavailableException extends ProviderException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ProviderFailure failure() {
        return ProviderFailure.UNAVAILABLE;
    }
}
