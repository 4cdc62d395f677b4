package com.yammer.dropwizard.directoryauth.flow;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.yammer.dropwizard.directoryauth.host.Credentials;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * What a login flow step hands back to the host: either a form to (re-)render or the finished entry.
 */
public final class FlowResult {

    public enum Type {
        FORM,
        CREATE_ENTRY
    }

    private final Type type;
    private final String stepId;
    private final ImmutableList<String> dataSchema;
    private final ImmutableMap<String, String> errors;
    private final ImmutableMap<String, String> data;
    private final Credentials credentials;

    private FlowResult(Type type, String stepId, List<String> dataSchema, Map<String, String> errors,
                       Map<String, String> data, Credentials credentials) {
        this.type = type;
        this.stepId = stepId;
        this.dataSchema = ImmutableList.copyOf(dataSchema);
        this.errors = ImmutableMap.copyOf(errors);
        this.data = ImmutableMap.copyOf(data);
        this.credentials = credentials;
    }

    static FlowResult form(String stepId, List<String> dataSchema, Map<String, String> errors) {
        return new FlowResult(Type.FORM, checkNotNull(stepId), dataSchema, errors, ImmutableMap.of(), null);
    }

    static FlowResult createEntry(Map<String, String> data, Credentials credentials) {
        return new FlowResult(Type.CREATE_ENTRY, null, ImmutableList.of(), ImmutableMap.of(), data,
                checkNotNull(credentials));
    }

    public Type getType() {
        return type;
    }

    public String getStepId() {
        return stepId;
    }

    /**
     * @return the names of the fields the form asks for, in display order
     */
    public ImmutableList<String> getDataSchema() {
        return dataSchema;
    }

    public ImmutableMap<String, String> getErrors() {
        return errors;
    }

    public ImmutableMap<String, String> getData() {
        return data;
    }

    public Optional<Credentials> getCredentials() {
        return Optional.ofNullable(credentials);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("type", type)
                .add("stepId", stepId)
                .add("dataSchema", dataSchema)
                .add("errors", errors)
                .add("data", data)
                .add("credentials", credentials)
                .toString();
    }
}
