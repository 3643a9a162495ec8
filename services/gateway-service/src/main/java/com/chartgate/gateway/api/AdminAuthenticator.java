package com.chartgate.gateway.api;

import com.chartgate.gateway.config.AdminProperties;
import com.chartgate.security.BearerTokenExtractor;
import com.chartgate.security.UnauthorizedException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Checks operator credentials on admin requests.
 *
 * <p>Accepts {@code Authorization: Basic} with the configured username and password, or
 * {@code Authorization: Bearer} carrying either the password alone or {@code username:password}.
 * Comparisons run in constant time.
 */
@Component
public class AdminAuthenticator {

    private static final String BASIC_PREFIX = "basic ";

    private final AdminProperties admin;

    public AdminAuthenticator(AdminProperties admin) {
        this.admin = admin;
    }

    /**
     * @throws AdminUnavailableException if no admin credentials are configured
     * @throws UnauthorizedException     if the header carries no valid admin credentials
     */
    public void authenticate(String authorizationHeader) {
        if (!admin.configured()) {
            throw new AdminUnavailableException();
        }
        if (authorizationHeader != null && matchesBasic(authorizationHeader)) {
            return;
        }
        Optional<String> bearer = BearerTokenExtractor.extract(authorizationHeader);
        if (bearer.isPresent() && matchesBearer(bearer.get())) {
            return;
        }
        throw new UnauthorizedException("Invalid admin credentials.");
    }

    private boolean matchesBasic(String header) {
        String trimmed = header.strip();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith(BASIC_PREFIX)) {
            return false;
        }
        String decoded;
        try {
            decoded = new String(
                    Base64.getDecoder().decode(trimmed.substring(BASIC_PREFIX.length()).strip()),
                    StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return matchesPair(decoded);
    }

    private boolean matchesBearer(String token) {
        return constantTimeEquals(token, admin.password()) || matchesPair(token);
    }

    private boolean matchesPair(String pair) {
        int colon = pair.indexOf(':');
        if (colon < 0) {
            return false;
        }
        boolean user = constantTimeEquals(pair.substring(0, colon), admin.username());
        boolean password = constantTimeEquals(pair.substring(colon + 1), admin.password());
        return user & password;
    }

    private static boolean constantTimeEquals(String presented, String expected) {
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }
}
