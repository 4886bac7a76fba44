package com.studioflow.orchestrator.provider;

/** No provider bean is registered under the requested name. */
public class ProviderNotFoundException extends ProviderException {

    public ProviderNotFoundException(String name) {
        super(Kind.REJECTED, "Provider not registered: '" + name + "'");
    }
}
