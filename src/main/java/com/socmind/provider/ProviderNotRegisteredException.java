package com.socmind.provider;

import com.socmind.core.model.ProviderFailure;

public class ProviderNotRegisteredException extends ProviderException {

    public ProviderNotRegisteredException(String message) {
        super(message);
    }

    public ProviderNotRegisteredException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ProviderFailure failure() {
        return ProviderFailure.NOT_REGISTERED;
    }
}
