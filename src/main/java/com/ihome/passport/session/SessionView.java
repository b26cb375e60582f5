package com.ihome.passport.session;

public record SessionView(String displayName) {
}
