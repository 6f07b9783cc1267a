package com.socmind.provider;

import com.socmind.core.model.ProviderFailure;

public class ProviderMalformedResponseException extends ProviderException {

    public ProviderMalformedResponseException(String message) {
        super(message);
    }

    public ProviderMalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ProviderFailure failure() {
        return ProviderFailure.MALFORMED_RESPONSE;
    }
}
