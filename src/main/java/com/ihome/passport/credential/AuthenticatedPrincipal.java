package com.ihome.passport.credential;

public record AuthenticatedPrincipal(
        long userId,
        String displayName,
        String identity
) {
}
