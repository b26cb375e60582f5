package com.ihome.passport.credential;

public enum CredentialStatus {
    AUTHENTICATED,
    INVALID_CREDENTIALS,
    STORE_UNAVAILABLE
}
