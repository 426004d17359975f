package com.timemarket.api.error;

public record ErrorResponse(String code, String message) {}
