package com.chartgate.security;

/**
 * Registration attempted with an email that already belongs to a tenant.
 */
public class AccountExistsException extends RuntimeException {

    public AccountExistsException(String email) {
        super("An account is already registered for " + email);
    }
}
