package com.yammer.dropwizard.directoryauth.host;

import java.util.List;
import java.util.Map;

/**
 * The host's credential storage, as seen by a login provider.
 */
public interface CredentialStore {

    /**
     * @return every credential previously issued for the given provider
     */
    List<Credentials> credentialsFor(String authProviderType, String authProviderId);

    /**
     * Builds a new credential for the given provider. The host decides if and when it gets persisted.
     */
    Credentials createCredentials(String authProviderType, String authProviderId, Map<String, String> data);
}
