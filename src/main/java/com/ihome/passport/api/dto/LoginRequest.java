package com.ihome.passport.api.dto;

import jakarta.validation.constraints.Size;

public record LoginRequest(
        @Size(max = 32) String mobile,
        @Size(max = 128) String password
) {
}
