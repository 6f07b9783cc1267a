package com.socmind.provider;

import com.socmind.core.model.ProviderFailure;

public class ProviderTimeoutException extends ProviderException {

    public ProviderTimeoutException(String message) {
        super(message);
    }

    public ProviderTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ProviderFailure failure() {
        return ProviderFailure.TIMEOUT;
    }
}
