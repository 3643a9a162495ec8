package com.chartgate.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies HS256-signed account session tokens.
 * <p>
 * Tokens are stateless: nothing is stored server side, so they stay valid until expiry. The
 * secret must be at least 32 bytes, the HS256 key size.
 */
public final class TokenIssuer {

    private static final Logger log = LoggerFactory.getLogger(TokenIssuer.class);

    static final String TOKEN_TYPE = "account";
    static final int MIN_SECRET_BYTES = 32;

    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_TYPE = "type";

    private final byte[] secret;
    private final Duration ttl;
    private final Clock clock;

    public TokenIssuer(String secret, Duration ttl, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "session secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Issues a session token for an account.
     *
     * @return compact serialized JWT
     */
    public String issue(String accountId, String email) {
        Instant now = clock.instant();
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .jwtID(UUID.randomUUID().toString())
                .subject(accountId)
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_TYPE, TOKEN_TYPE)
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plus(ttl)))
                .build();
        try {
            SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
            JWSSigner signer = new MACSigner(secret);
            jwt.sign(signer);
            log.debug("Issued session token for account {}", accountId);
            return jwt.serialize();
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign session token", e);
        }
    }

    /**
     * Verifies signature, type and expiry.
     *
     * @throws InvalidTokenException if the token is malformed, wrongly signed or lacks claims
     * @throws ExpiredTokenException if the token is correctly signed but past expiry
     */
    public AccountSession verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Missing session token");
        }
        try {
            SignedJWT jwt = SignedJWT.parse(token);
            if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
                throw new InvalidTokenException("Unsupported token algorithm");
            }
            JWSVerifier verifier = new MACVerifier(secret);
            if (!jwt.verify(verifier)) {
                throw new InvalidTokenException("Invalid token signature");
            }
            JWTClaimsSet claims = jwt.getJWTClaimsSet();
            if (!TOKEN_TYPE.equals(claims.getStringClaim(CLAIM_TYPE))) {
                throw new InvalidTokenException("Invalid token type");
            }
            if (claims.getSubject() == null || claims.getExpirationTime() == null) {
                throw new InvalidTokenException("Token is missing required claims");
            }
            Instant expiresAt = claims.getExpirationTime().toInstant();
            if (!clock.instant().isBefore(expiresAt)) {
                throw new ExpiredTokenException(expiresAt);
            }
            Instant issuedAt = claims.getIssueTime() == null ? null : claims.getIssueTime().toInstant();
            return new AccountSession(
                    claims.getSubject(), claims.getStringClaim(CLAIM_EMAIL), issuedAt, expiresAt);
        } catch (ParseException | JOSEException e) {
            throw new InvalidTokenException("Invalid session token", e);
        }
    }

    public Duration ttl() {
        return ttl;
    }
}
