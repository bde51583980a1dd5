package com.fw24.framework.authorize;

import lombok.Value;

import java.util.List;

@Value
public class AuthorizationResult {
    boolean pass;
    List<String> errors;

    public static AuthorizationResult allow() {
        return new AuthorizationResult(true, List.of());
    }

    public static AuthorizationResult deny(String... reasons) {
        return new AuthorizationResult(false, List.of(reasons));
    }
}
