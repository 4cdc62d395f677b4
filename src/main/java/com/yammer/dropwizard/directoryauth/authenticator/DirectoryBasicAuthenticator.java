package com.yammer.dropwizard.directoryauth.authenticator;

import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import io.dropwizard.auth.basic.BasicCredentials;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Exposes the directory to Dropwizard's HTTP Basic auth filter. Rejected credentials and group denials yield no
 * principal; directory faults surface as {@link AuthenticationException} so the filter answers with a server error.
 */
public class DirectoryBasicAuthenticator implements Authenticator<BasicCredentials, DirectoryIdentity> {

    private final LdapAuthenticationProvider ldapAuthenticator;

    public DirectoryBasicAuthenticator(LdapAuthenticationProvider ldapAuthenticator) {
        this.ldapAuthenticator = checkNotNull(ldapAuthenticator);
    }

    @Override
    public Optional<DirectoryIdentity> authenticate(BasicCredentials credentials) throws AuthenticationException {
        final AuthenticationOutcome outcome = ldapAuthenticator.authenticate(
                new AuthnRequest(credentials.getUsername(), credentials.getPassword()));
        if (outcome.isSuccess()) {
            return outcome.getIdentity();
        }
        switch (outcome.getFailure().orElseThrow(IllegalStateException::new)) {
            case INVALID_CREDENTIALS:
            case GROUP_MEMBERSHIP_DENIED:
                return Optional.empty();
            default:
                throw new AuthenticationException(
                        String.format("LDAP Authentication failure (username: %s)", credentials.getUsername()));
        }
    }
}
