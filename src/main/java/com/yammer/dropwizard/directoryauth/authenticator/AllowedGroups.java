package com.yammer.dropwizard.directoryauth.authenticator;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import org.apache.commons.lang3.StringUtils;

/**
 * Group DN allow-list. DNs are compared case-insensitively; an empty list admits everyone.
 */
public final class AllowedGroups {
	private final ImmutableSet<String> groups;

	public AllowedGroups(Set<String> groupDns) {
		final ImmutableSet.Builder<String> normalized = ImmutableSet.builder();
		for (String group : groupDns) {
			if (StringUtils.isNotBlank(group)) {
				normalized.add(normalize(group));
			}
		}
		this.groups = normalized.build();
	}

	private static String normalize(String dn) {
		return dn.trim().toLowerCase(Locale.ROOT);
	}

	public boolean isRestricted() {
		return !groups.isEmpty();
	}

	public boolean permits(Collection<String> memberOf) {
		if (groups.isEmpty()) {
			return true;
		}
		for (String group : memberOf) {
			if (groups.contains(normalize(group))) {
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("groups", groups).toString();
	}
}
