package com.moddock.api.error;

public record ErrorResponse(
        String code,
        String message
) {}
