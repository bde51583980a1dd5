package com.fw24.framework.authorize;

public interface EntityAuthorizer {
    AuthorizationResult authorize(AuthorizationRequest request);
}
