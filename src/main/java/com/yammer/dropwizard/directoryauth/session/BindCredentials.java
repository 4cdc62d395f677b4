package com.yammer.dropwizard.directoryauth.session;

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The principal and password a connection is bound with. {@link #toString()} never prints the password.
 */
public final class BindCredentials {
    private static final BindCredentials ANONYMOUS = new BindCredentials(BindStrategy.Identity.ANONYMOUS, "", "");

    private final BindStrategy.Identity identity;
    private final String principal;
    private final String password;

    BindCredentials(BindStrategy.Identity identity, String principal, String password) {
        this.identity = checkNotNull(identity);
        this.principal = checkNotNull(principal);
        this.password = checkNotNull(password);
    }

    public static BindCredentials anonymous() {
        return ANONYMOUS;
    }

    public BindStrategy.Identity getIdentity() {
        return identity;
    }

    public String getPrincipal() {
        return principal;
    }

    public String getPassword() {
        return password;
    }

    public boolean isAnonymous() {
        return identity == BindStrategy.Identity.ANONYMOUS;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("identity", identity)
                .add("principal", principal)
                .toString();
    }
}
