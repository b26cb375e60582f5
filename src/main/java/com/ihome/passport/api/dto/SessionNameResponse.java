package com.ihome.passport.api.dto;

public record SessionNameResponse(String name) {
}
