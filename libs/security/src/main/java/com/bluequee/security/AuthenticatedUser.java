package com.bluequee.security;

/**
 * Authenticated user as asserted by the gateway after token validation.
 *
 * <p>WHY a record: immutable, thread-safe, auto-generated equals/hashCode/toString. This is the
 * "who" in every ownership check.
 *
 * @param userId unique user identifier
 * @param username login username
 * @param displayName optional human-readable name (e.g. "Dr. Ada Okafor")
 */
public record AuthenticatedUser(Long userId, String username, String displayName) {}
