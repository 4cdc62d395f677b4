package com.yammer.dropwizard.directoryauth.flow;

import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.yammer.dropwizard.directoryauth.AuthProvider;
import com.yammer.dropwizard.directoryauth.authenticator.AuthFailure;
import com.yammer.dropwizard.directoryauth.authenticator.AuthenticationOutcome;
import com.yammer.dropwizard.directoryauth.authenticator.AuthnRequest;
import com.yammer.dropwizard.directoryauth.authenticator.LdapAuthenticationProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

public class LdapLoginFlow extends LoginFlow {
    private static final Logger LOG = LoggerFactory.getLogger(LdapLoginFlow.class);

    public static final String USERNAME = "username";
    public static final String PASSWORD = "password";
    public static final String INVALID_AUTH = "invalid_auth";
    public static final String ERROR = "error";

    private static final ImmutableList<String> SCHEMA = ImmutableList.of(USERNAME, PASSWORD);

    private final LdapAuthenticationProvider authenticator;

    public LdapLoginFlow(AuthProvider authProvider, LdapAuthenticationProvider authenticator) {
        super(authProvider);
        this.authenticator = checkNotNull(authenticator);
    }

    @Override
    public FlowResult stepInit(Map<String, String> userInput) {
        checkAwaitingCredentials();
        if (userInput == null) {
            return showForm(STEP_INIT, SCHEMA, ImmutableMap.of());
        }

        final String username = Strings.nullToEmpty(userInput.get(USERNAME));
        final AuthenticationOutcome outcome = authenticator.authenticate(
                new AuthnRequest(username, Strings.nullToEmpty(userInput.get(PASSWORD))));
        if (outcome.isSuccess()) {
            // the password goes no further than this step
            return finish(ImmutableMap.of(USERNAME, username));
        }

        final AuthFailure failure = outcome.getFailure().orElseThrow(IllegalStateException::new);
        LOG.debug("Login for {} failed: {}", username, failure);
        return showForm(STEP_INIT, SCHEMA, ImmutableMap.of(BASE_ERROR, errorCode(failure)));
    }

    static String errorCode(AuthFailure failure) {
        switch (failure) {
            case INVALID_CREDENTIALS:
            case GROUP_MEMBERSHIP_DENIED:
                return INVALID_AUTH;
            default:
                return ERROR;
        }
    }
}
