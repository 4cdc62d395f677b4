package com.yammer.dropwizard.directoryauth;

import com.yammer.dropwizard.directoryauth.host.CredentialStore;

@FunctionalInterface
public interface AuthProviderFactory {

    AuthProvider build(AuthProviderConfiguration configuration, CredentialStore credentialStore);

}
