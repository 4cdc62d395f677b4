package com.yammer.dropwizard.directoryauth;

import com.codahale.metrics.health.HealthCheck;
import com.yammer.dropwizard.directoryauth.authenticator.LdapAuthenticationProvider;

import static com.google.common.base.Preconditions.checkNotNull;

public class LdapHealthCheck extends HealthCheck {
    private final LdapAuthenticationProvider ldapAuthenticator;
    private final String server;

    public LdapHealthCheck(LdapAuthenticationProvider ldapAuthenticator, String server) {
        this.ldapAuthenticator = checkNotNull(ldapAuthenticator);
        this.server = checkNotNull(server);
    }

    @Override
    protected Result check() throws Exception {
        if (ldapAuthenticator.canAuthenticate()) {
            return Result.healthy();
        }
        return Result.unhealthy("Cannot contact authentication service at %s", server);
    }
}
