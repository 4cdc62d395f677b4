package com.yammer.dropwizard.directoryauth.flow;

import java.util.HashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.yammer.dropwizard.directoryauth.DirectoryConfiguration;
import com.yammer.dropwizard.directoryauth.InMemoryCredentialStore;
import com.yammer.dropwizard.directoryauth.LdapAuthProvider;
import com.yammer.dropwizard.directoryauth.authenticator.AuthFailure;
import com.yammer.dropwizard.directoryauth.authenticator.AuthenticationOutcome;
import com.yammer.dropwizard.directoryauth.authenticator.AuthnRequest;
import com.yammer.dropwizard.directoryauth.authenticator.DirectoryIdentity;
import com.yammer.dropwizard.directoryauth.authenticator.LdapAuthenticationProvider;
import com.yammer.dropwizard.directoryauth.host.Credentials;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LdapLoginFlowTest {
    private static final AuthenticationOutcome JDOE = AuthenticationOutcome.success(
            new DirectoryIdentity("jdoe", "John Doe", "uid=jdoe,dc=example,dc=com", ImmutableSet.of()));

    @Mock
    private LdapAuthenticationProvider authenticator;

    private InMemoryCredentialStore credentialStore;
    private LdapAuthProvider provider;

    @BeforeEach
    void setUp() {
        credentialStore = new InMemoryCredentialStore();
        final DirectoryConfiguration configuration = new DirectoryConfiguration()
                .setServer("ldap.example.com")
                .setBaseDn("dc=example,dc=com")
                .setBindUsername("admin")
                .setBindPassword("secret");
        provider = new LdapAuthProvider(configuration, credentialStore, authenticator);
    }

    private static Map<String, String> submit(String username, String password) {
        return ImmutableMap.of(LdapLoginFlow.USERNAME, username, LdapLoginFlow.PASSWORD, password);
    }

    private LoginFlow flow() {
        return provider.loginFlow(ImmutableMap.of());
    }

    @Test
    void firstStepShowsTheCredentialForm() {
        final FlowResult result = flow().stepInit(null);

        assertThat(result.getType()).isEqualTo(FlowResult.Type.FORM);
        assertThat(result.getStepId()).isEqualTo(LoginFlow.STEP_INIT);
        assertThat(result.getDataSchema()).containsExactly("username", "password");
        assertThat(result.getErrors()).isEmpty();
        verifyNoInteractions(authenticator);
    }

    @Test
    void rejectedCredentialsAreInvalidAuth() {
        when(authenticator.authenticate(any()))
                .thenReturn(AuthenticationOutcome.failure(AuthFailure.INVALID_CREDENTIALS, "bad password"));
        final LoginFlow flow = flow();

        final FlowResult result = flow.stepInit(submit("jdoe", "wrong"));

        assertThat(result.getType()).isEqualTo(FlowResult.Type.FORM);
        assertThat(result.getErrors()).containsExactly(entry("base", "invalid_auth"));
        assertThat(flow.getState()).isEqualTo(LoginFlowState.AWAITING_CREDENTIALS);
        assertThat(credentialStore.getStored()).isEmpty();
    }

    @Test
    void groupDenialLooksLikeInvalidAuth() {
        when(authenticator.authenticate(any()))
                .thenReturn(AuthenticationOutcome.failure(AuthFailure.GROUP_MEMBERSHIP_DENIED, "not staff"));

        assertThat(flow().stepInit(submit("jdoe", "hunter2")).getErrors())
                .containsExactly(entry("base", "invalid_auth"));
    }

    @Test
    void directoryFaultsAreGenericErrors() {
        when(authenticator.authenticate(any()))
                .thenReturn(AuthenticationOutcome.failure(AuthFailure.TRANSPORT_FAILURE, "down"))
                .thenReturn(AuthenticationOutcome.failure(AuthFailure.DIRECTORY_QUERY_FAILURE, "no entry"));
        final LoginFlow flow = flow();

        assertThat(flow.stepInit(submit("jdoe", "hunter2")).getErrors()).containsExactly(entry("base", "error"));
        assertThat(flow.stepInit(submit("jdoe", "hunter2")).getErrors()).containsExactly(entry("base", "error"));
        assertThat(flow.getState()).isEqualTo(LoginFlowState.AWAITING_CREDENTIALS);
    }

    @Test
    void successCompletesWithUsernameOnly() {
        when(authenticator.authenticate(any())).thenReturn(JDOE);
        final LoginFlow flow = flow();

        final FlowResult result = flow.stepInit(submit("jdoe", "hunter2"));

        assertThat(result.getType()).isEqualTo(FlowResult.Type.CREATE_ENTRY);
        assertThat(result.getData()).containsExactly(entry("username", "jdoe"));
        assertThat(result.getCredentials()).hasValueSatisfying(c -> {
            assertThat(c.isNew()).isTrue();
            assertThat(c.getData()).doesNotContainKey("password");
        });
        assertThat(flow.getState()).isEqualTo(LoginFlowState.COMPLETED);
    }

    @Test
    void completedFlowAcceptsNoFurtherInput() {
        when(authenticator.authenticate(any())).thenReturn(JDOE);
        final LoginFlow flow = flow();
        flow.stepInit(submit("jdoe", "hunter2"));

        assertThatThrownBy(() -> flow.stepInit(submit("jdoe", "hunter2")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Login flow already completed");
    }

    @Test
    void userMayRetryAfterFailure() {
        when(authenticator.authenticate(any()))
                .thenReturn(AuthenticationOutcome.failure(AuthFailure.INVALID_CREDENTIALS, "bad password"))
                .thenReturn(JDOE);
        final LoginFlow flow = flow();

        assertThat(flow.stepInit(submit("jdoe", "wrong")).getType()).isEqualTo(FlowResult.Type.FORM);
        assertThat(flow.stepInit(submit("jdoe", "hunter2")).getType()).isEqualTo(FlowResult.Type.CREATE_ENTRY);
    }

    @Test
    void repeatLoginsReuseCredentials() {
        when(authenticator.authenticate(any())).thenReturn(JDOE);

        final Credentials first = flow().stepInit(submit("jdoe", "hunter2")).getCredentials().get();
        final Credentials second = flow().stepInit(submit("jdoe", "hunter2")).getCredentials().get();

        assertThat(second).isEqualTo(first);
        assertThat(second.isNew()).isFalse();
        assertThat(credentialStore.getStored()).hasSize(1);
    }

    @Test
    void passesSubmittedCredentialsToAuthenticator() {
        when(authenticator.authenticate(any())).thenReturn(JDOE);

        flow().stepInit(submit("jdoe", "hunter2"));

        final ArgumentCaptor<AuthnRequest> request = ArgumentCaptor.forClass(AuthnRequest.class);
        verify(authenticator).authenticate(request.capture());
        assertThat(request.getValue().getUsername()).isEqualTo("jdoe");
        assertThat(request.getValue().getPassword()).isEqualTo("hunter2");
    }

    @Test
    void missingFieldsAreSubmittedAsEmpty() {
        when(authenticator.authenticate(any()))
                .thenReturn(AuthenticationOutcome.failure(AuthFailure.INVALID_CREDENTIALS, "empty"));
        final Map<String, String> input = new HashMap<>();
        input.put(LdapLoginFlow.USERNAME, "jdoe");

        flow().stepInit(input);

        final ArgumentCaptor<AuthnRequest> request = ArgumentCaptor.forClass(AuthnRequest.class);
        verify(authenticator).authenticate(request.capture());
        assertThat(request.getValue().getPassword()).isEmpty();
    }

    @Test
    void mapsEveryFailureToAnErrorCode() {
        assertThat(LdapLoginFlow.errorCode(AuthFailure.INVALID_CREDENTIALS)).isEqualTo("invalid_auth");
        assertThat(LdapLoginFlow.errorCode(AuthFailure.GROUP_MEMBERSHIP_DENIED)).isEqualTo("invalid_auth");
        assertThat(LdapLoginFlow.errorCode(AuthFailure.TRANSPORT_FAILURE)).isEqualTo("error");
        assertThat(LdapLoginFlow.errorCode(AuthFailure.DIRECTORY_QUERY_FAILURE)).isEqualTo("error");
    }
}
