package com.yammer.dropwizard.directoryauth;

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.yammer.dropwizard.directoryauth.host.CredentialStore;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Maps provider type tags to factories. The built-in set is fixed at class initialisation; hosts wanting more kinds
 * pass their own map.
 */
public final class AuthProviders {
    private static final AuthProviders DEFAULTS = new AuthProviders(ImmutableMap.of(
            DirectoryConfiguration.TYPE, LdapAuthProvider::create));

    private final ImmutableMap<String, AuthProviderFactory> factories;

    public AuthProviders(Map<String, AuthProviderFactory> factories) {
        this.factories = ImmutableMap.copyOf(factories);
    }

    public static AuthProviders defaults() {
        return DEFAULTS;
    }

    public Set<String> getTypes() {
        return factories.keySet();
    }

    public AuthProvider build(AuthProviderConfiguration configuration, CredentialStore credentialStore) {
        checkNotNull(configuration);
        final AuthProviderFactory factory = factories.get(configuration.getType());
        checkArgument(factory != null, "Unknown auth provider type: %s", configuration.getType());
        return factory.build(configuration, credentialStore);
    }
}
