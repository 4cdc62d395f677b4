package com.yammer.dropwizard.directoryauth.flow;

import java.util.List;
import java.util.Map;

import com.yammer.dropwizard.directoryauth.AuthProvider;
import com.yammer.dropwizard.directoryauth.host.Credentials;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * A conversational login. The host calls {@link #stepInit(Map)} without input to get the first form, then again with
 * whatever the user submitted until the flow completes.
 */
public abstract class LoginFlow {
    public static final String BASE_ERROR = "base";
    public static final String STEP_INIT = "init";

    protected final AuthProvider authProvider;
    private LoginFlowState state = LoginFlowState.AWAITING_CREDENTIALS;

    protected LoginFlow(AuthProvider authProvider) {
        this.authProvider = checkNotNull(authProvider);
    }

    public LoginFlowState getState() {
        return state;
    }

    /**
     * @param userInput the submitted form fields, or {@code null} to request the form
     */
    public abstract FlowResult stepInit(Map<String, String> userInput);

    protected void checkAwaitingCredentials() {
        checkState(state == LoginFlowState.AWAITING_CREDENTIALS, "Login flow already completed");
    }

    protected FlowResult showForm(String stepId, List<String> dataSchema, Map<String, String> errors) {
        return FlowResult.form(stepId, dataSchema, errors);
    }

    protected FlowResult finish(Map<String, String> data) {
        checkAwaitingCredentials();
        final Credentials credentials = authProvider.getOrCreateCredentials(data);
        state = LoginFlowState.COMPLETED;
        return FlowResult.createEntry(data, credentials);
    }
}
