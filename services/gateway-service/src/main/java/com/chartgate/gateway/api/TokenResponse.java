package com.chartgate.gateway.api;

/**
 * Session token issued at registration or login.
 *
 * @param accessToken signed session token, sent back as {@code Authorization: Bearer}
 * @param tokenType   always "bearer"
 * @param expiresIn   lifetime in seconds
 * @param accountId   the tenant the token belongs to
 */
public record TokenResponse(String accessToken, String tokenType, long expiresIn, String accountId) {

    static TokenResponse bearer(String token, long expiresInSeconds, String accountId) {
        return new TokenResponse(token, "bearer", expiresInSeconds, accountId);
    }
}
