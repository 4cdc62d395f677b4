package com.yammer.dropwizard.directoryauth.authenticator;

import java.security.Principal;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import static com.google.common.base.Preconditions.checkNotNull;

public final class DirectoryIdentity implements Principal {
	private final String username;
	private final String displayName;
	private final String dn;
	private final ImmutableSet<String> groups;

	public DirectoryIdentity(String username, String displayName, String dn, Set<String> groups) {
		this.username = checkNotNull(username);
		this.displayName = displayName;
		this.dn = checkNotNull(dn);
		this.groups = ImmutableSet.copyOf(groups);
	}

	/**
	 * @return the canonical account name read from the directory entry
	 */
	@Override
	public String getName() {
		return username;
	}

	public String getDisplayName() {
		return displayName;
	}

	public String getDn() {
		return dn;
	}

	public ImmutableSet<String> getGroups() {
		return groups;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof DirectoryIdentity)) {
			return false;
		}
		final DirectoryIdentity other = (DirectoryIdentity) o;
		return username.equals(other.username) && Objects.equals(displayName, other.displayName)
				&& dn.equals(other.dn) && groups.equals(other.groups);
	}

	@Override
	public int hashCode() {
		return Objects.hash(username, displayName, dn, groups);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("username", username)
				.add("displayName", displayName)
				.add("dn", dn)
				.add("groups", groups)
				.toString();
	}
}
