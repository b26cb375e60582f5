package com.ihome.passport.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @Size(max = 32) String mobile,
        @JsonProperty("sms_code") @Size(max = 16) String smsCode,
        @Size(max = 128) String password,
        @Size(max = 128) String password2
) {
}
