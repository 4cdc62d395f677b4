package com.yammer.dropwizard.directoryauth.session;

import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One search result: the entry DN and the string values of the requested attributes, keyed by the attribute name as
 * it was requested.
 */
public final class DirectoryEntry {
    private final String dn;
    private final ImmutableListMultimap<String, String> attributes;

    public DirectoryEntry(String dn, ImmutableListMultimap<String, String> attributes) {
        this.dn = checkNotNull(dn);
        this.attributes = checkNotNull(attributes);
    }

    public String getDn() {
        return dn;
    }

    public ImmutableList<String> getValues(String attribute) {
        return attributes.get(attribute);
    }

    public Optional<String> getFirstValue(String attribute) {
        return attributes.get(attribute).stream().findFirst();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("dn", dn).add("attributes", attributes).toString();
    }
}
