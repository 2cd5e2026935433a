package org.courtside.rotation.web;

public record ApiErrorResponse(String code, String message) {}
