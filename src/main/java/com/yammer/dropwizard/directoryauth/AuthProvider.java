package com.yammer.dropwizard.directoryauth;

import java.util.List;
import java.util.Map;

import com.yammer.dropwizard.directoryauth.flow.LoginFlow;
import com.yammer.dropwizard.directoryauth.host.CredentialStore;
import com.yammer.dropwizard.directoryauth.host.Credentials;
import com.yammer.dropwizard.directoryauth.host.UserMeta;

import org.apache.commons.lang3.StringUtils;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A source of user logins plugged into the host. Credentials are created through, and owned by, the host's
 * {@link CredentialStore}.
 */
public abstract class AuthProvider {
    private final AuthProviderConfiguration configuration;
    private final CredentialStore credentialStore;

    protected AuthProvider(AuthProviderConfiguration configuration, CredentialStore credentialStore) {
        this.configuration = checkNotNull(configuration);
        this.credentialStore = checkNotNull(credentialStore);
    }

    public String getType() {
        return configuration.getType();
    }

    public String getId() {
        return configuration.getId();
    }

    public String getName() {
        return StringUtils.defaultIfEmpty(configuration.getName(), defaultTitle());
    }

    protected abstract String defaultTitle();

    /**
     * @return the credentials the host has already issued for this provider
     */
    public List<Credentials> credentials() {
        return credentialStore.credentialsFor(getType(), getId());
    }

    public Credentials createCredentials(Map<String, String> data) {
        return credentialStore.createCredentials(getType(), getId(), data);
    }

    public abstract LoginFlow loginFlow(Map<String, String> context);

    /**
     * Resolves the payload of a completed login flow to an existing credential or a new one.
     */
    public abstract Credentials getOrCreateCredentials(Map<String, String> flowResult);

    public abstract UserMeta userMetaForCredentials(Credentials credentials);
}
