package com.bluequee.tabconfig.api.dto;

/**
 * Acknowledgement of a mutation without a record body.
 *
 * @param message what happened
 * @param count records affected
 */
public record MutationResponse(String message, int count) {}
