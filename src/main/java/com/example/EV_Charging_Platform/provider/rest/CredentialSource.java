package com.example.EV_Charging_Platform.provider.rest;

import com.example.EV_Charging_Platform.provider.ProviderException;

/**
 * Supplies the bearer token a provider API expects. Token issuance itself lives outside this service.
 */
public interface CredentialSource {

    String currentToken();

    /**
     * Obtain a fresh token, replacing the current one
     */
    String refresh() throws ProviderException;

    static CredentialSource fixed(String token) {
        return new CredentialSource() {
            @Override
            public String currentToken() {
                return token;
            }

            @Override
            public String refresh() {
                return token;
            }
        };
    }
}
