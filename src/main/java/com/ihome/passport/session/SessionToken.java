package com.ihome.passport.session;

public record SessionToken(String sessionId, String displayName) {
}
