package com.chartgate.security;

/**
 * Authenticates account-management requests from their {@code Authorization} header.
 */
public final class SessionAuthenticator {

    private final TokenIssuer tokens;

    public SessionAuthenticator(TokenIssuer tokens) {
        this.tokens = tokens;
    }

    /**
     * @throws UnauthorizedException if no bearer token is present
     * @throws InvalidTokenException if the token does not verify
     * @throws ExpiredTokenException if the token has expired
     */
    public AccountSession authenticate(String authorizationHeader) {
        String token = BearerTokenExtractor.extract(authorizationHeader)
                .orElseThrow(() -> new UnauthorizedException(
                        "Missing session token. Provide an Authorization: Bearer header."));
        return tokens.verify(token);
    }
}
