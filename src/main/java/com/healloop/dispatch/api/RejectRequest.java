package com.healloop.dispatch.api;

/**
 * Request body for the reject endpoint.
 */
public record RejectRequest(String reason) {}
