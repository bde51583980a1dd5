package com.fw24.framework.authorize;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Grants every request. Suitable for services that authorize at the transport layer.
 */
@ApplicationScoped
public class AllowAllAuthorizer implements EntityAuthorizer {

    @Override
    public AuthorizationResult authorize(AuthorizationRequest request) {
        return AuthorizationResult.allow();
    }
}
