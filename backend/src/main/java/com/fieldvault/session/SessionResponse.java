package com.fieldvault.session;

public record SessionResponse(KeyState state, String reason) {

    static SessionResponse from(InitializationResult result) {
        return new SessionResponse(result.state(),
                result.cause() == null ? null : result.cause().getMessage());
    }
}
