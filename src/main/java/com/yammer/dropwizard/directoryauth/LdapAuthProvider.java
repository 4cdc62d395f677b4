package com.yammer.dropwizard.directoryauth;

import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.yammer.dropwizard.directoryauth.authenticator.AuthenticationOutcome;
import com.yammer.dropwizard.directoryauth.authenticator.AuthnRequest;
import com.yammer.dropwizard.directoryauth.authenticator.LdapAuthenticationProvider;
import com.yammer.dropwizard.directoryauth.authenticator.LdapSearchingAuthenticator;
import com.yammer.dropwizard.directoryauth.flow.LdapLoginFlow;
import com.yammer.dropwizard.directoryauth.flow.LoginFlow;
import com.yammer.dropwizard.directoryauth.host.CredentialStore;
import com.yammer.dropwizard.directoryauth.host.Credentials;
import com.yammer.dropwizard.directoryauth.host.UserMeta;
import com.yammer.dropwizard.directoryauth.session.LdapSessionBuilder;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

public class LdapAuthProvider extends AuthProvider {
    public static final String DEFAULT_TITLE = "LDAP Authentication";

    private final DirectoryConfiguration configuration;
    private final LdapAuthenticationProvider authenticator;

    public LdapAuthProvider(DirectoryConfiguration configuration, CredentialStore credentialStore) {
        this(configuration, credentialStore, new LdapSearchingAuthenticator(configuration));
    }

    public LdapAuthProvider(DirectoryConfiguration configuration, CredentialStore credentialStore,
                            LdapAuthenticationProvider authenticator) {
        super(configuration, credentialStore);
        this.configuration = configuration;
        this.authenticator = checkNotNull(authenticator);
    }

    static LdapAuthProvider create(AuthProviderConfiguration configuration, CredentialStore credentialStore) {
        checkArgument(configuration instanceof DirectoryConfiguration,
                "ldap provider needs a DirectoryConfiguration, got %s", configuration.getClass().getName());
        return new LdapAuthProvider((DirectoryConfiguration) configuration, credentialStore);
    }

    @Override
    protected String defaultTitle() {
        return DEFAULT_TITLE;
    }

    public LdapAuthenticationProvider getAuthenticator() {
        return authenticator;
    }

    @Override
    public LoginFlow loginFlow(Map<String, String> context) {
        return new LdapLoginFlow(this, authenticator);
    }

    public AuthenticationOutcome validateLogin(String username, String password) {
        return authenticator.authenticate(new AuthnRequest(username, password));
    }

    @Override
    public Credentials getOrCreateCredentials(Map<String, String> flowResult) {
        final String username = checkNotNull(flowResult.get(LdapLoginFlow.USERNAME), "No username in flow result");

        for (Credentials credential : credentials()) {
            if (username.equals(credential.getData().get(LdapLoginFlow.USERNAME))) {
                return credential;
            }
        }

        return createCredentials(ImmutableMap.of(LdapLoginFlow.USERNAME, username));
    }

    @Override
    public UserMeta userMetaForCredentials(Credentials credentials) {
        return new UserMeta(credentials.getData().get(LdapLoginFlow.USERNAME), true);
    }

    public LdapHealthCheck healthCheck() {
        return new LdapHealthCheck(authenticator, new LdapSessionBuilder(configuration).getProviderUrl());
    }
}
