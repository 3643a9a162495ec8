package com.chartgate.security;

import java.time.Instant;

/**
 * Claims of a verified account session token.
 *
 * @param accountId tenant the session belongs to
 * @param email     login email at issue time
 * @param issuedAt  issue time
 * @param expiresAt expiry time
 */
public record AccountSession(String accountId, String email, Instant issuedAt, Instant expiresAt) {}
