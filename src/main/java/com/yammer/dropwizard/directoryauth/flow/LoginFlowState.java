package com.yammer.dropwizard.directoryauth.flow;

public enum LoginFlowState {
    AWAITING_CREDENTIALS,
    COMPLETED
}
