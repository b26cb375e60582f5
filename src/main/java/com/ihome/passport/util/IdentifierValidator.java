package com.ihome.passport.util;

import com.ihome.passport.config.AuthProperties;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class IdentifierValidator {

    private final Pattern mobilePattern;

    public IdentifierValidator(AuthProperties properties) {
        this.mobilePattern = Pattern.compile(properties.getIdentity().getPattern());
    }

    public boolean isValidMobile(String mobile) {
        return mobile != null && mobilePattern.matcher(mobile).matches();
    }
}
