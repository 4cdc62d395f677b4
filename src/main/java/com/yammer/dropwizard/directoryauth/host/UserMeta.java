package com.yammer.dropwizard.directoryauth.host;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Profile hints handed to the host when it creates a user for a new credential.
 */
public final class UserMeta {
    private final String name;
    private final boolean isActive;

    public UserMeta(String name, boolean isActive) {
        this.name = name;
        this.isActive = isActive;
    }

    public String getName() {
        return name;
    }

    public boolean isActive() {
        return isActive;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UserMeta)) {
            return false;
        }
        UserMeta other = (UserMeta) o;
        return isActive == other.isActive && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, isActive);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", name).add("isActive", isActive).toString();
    }
}
