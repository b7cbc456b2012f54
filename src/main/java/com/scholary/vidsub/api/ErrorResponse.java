package com.scholary.vidsub.api;

/** Error body returned for every failed request. */
public record ErrorResponse(String error, String message) {}
