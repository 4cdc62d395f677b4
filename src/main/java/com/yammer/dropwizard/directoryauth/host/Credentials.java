package com.yammer.dropwizard.directoryauth.host;

import java.util.Map;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A credential record owned by the host. Login providers look these up or ask the host to create them, but never
 * store them.
 */
public final class Credentials {
    private final String id;
    private final String authProviderType;
    private final String authProviderId;
    private final ImmutableMap<String, String> data;
    private final boolean isNew;

    public Credentials(String id, String authProviderType, String authProviderId, Map<String, String> data,
                       boolean isNew) {
        this.id = checkNotNull(id);
        this.authProviderType = checkNotNull(authProviderType);
        this.authProviderId = authProviderId;
        this.data = ImmutableMap.copyOf(data);
        this.isNew = isNew;
    }

    public String getId() {
        return id;
    }

    public String getAuthProviderType() {
        return authProviderType;
    }

    public String getAuthProviderId() {
        return authProviderId;
    }

    public ImmutableMap<String, String> getData() {
        return data;
    }

    public boolean isNew() {
        return isNew;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Credentials)) {
            return false;
        }
        return id.equals(((Credentials) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("authProviderType", authProviderType)
                .add("authProviderId", authProviderId)
                .add("data", data)
                .add("isNew", isNew)
                .toString();
    }
}
