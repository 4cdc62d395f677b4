package com.yammer.dropwizard.directoryauth;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class AuthProvidersTest {
    private final InMemoryCredentialStore credentialStore = new InMemoryCredentialStore();

    private static DirectoryConfiguration configuration() {
        return new DirectoryConfiguration()
                .setServer("ldap.example.com")
                .setBaseDn("dc=example,dc=com")
                .setBindUsername("admin")
                .setBindPassword("secret");
    }

    @Test
    void registersLdapByDefault() {
        assertThat(AuthProviders.defaults().getTypes()).containsExactly("ldap");
    }

    @Test
    void buildsLdapProvider() {
        final AuthProvider provider = AuthProviders.defaults().build(configuration(), credentialStore);

        assertThat(provider).isInstanceOf(LdapAuthProvider.class);
        assertThat(provider.getType()).isEqualTo("ldap");
        assertThat(provider.getName()).isEqualTo(LdapAuthProvider.DEFAULT_TITLE);
    }

    @Test
    void rejectsUnknownType() {
        final DirectoryConfiguration configuration = configuration();
        configuration.setType("oauth");

        assertThatThrownBy(() -> AuthProviders.defaults().build(configuration, credentialStore))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown auth provider type: oauth");
    }

    @Test
    void usesSuppliedFactories() {
        final AuthProvider custom = mock(AuthProvider.class);
        final AuthProviders providers = new AuthProviders(
                ImmutableMap.<String, AuthProviderFactory>of("custom", (c, s) -> custom));
        final DirectoryConfiguration configuration = configuration();
        configuration.setType("custom");

        assertThat(providers.build(configuration, credentialStore)).isSameAs(custom);
        assertThat(providers.getTypes()).containsExactly("custom");
    }
}
