package com.yammer.dropwizard.directoryauth.session;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.dropwizard.util.Duration;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A subtree search for a single entry.
 */
public final class DirectorySearch {
    private final String baseDn;
    private final String filter;
    private final ImmutableList<String> attributes;
    private final Duration timeLimit;

    public DirectorySearch(String baseDn, String filter, List<String> attributes, Duration timeLimit) {
        this.baseDn = checkNotNull(baseDn);
        this.filter = checkNotNull(filter);
        this.attributes = ImmutableList.copyOf(attributes);
        this.timeLimit = checkNotNull(timeLimit);
    }

    public String getBaseDn() {
        return baseDn;
    }

    public String getFilter() {
        return filter;
    }

    public ImmutableList<String> getAttributes() {
        return attributes;
    }

    public Duration getTimeLimit() {
        return timeLimit;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("baseDn", baseDn)
                .add("filter", filter)
                .add("attributes", attributes)
                .add("timeLimit", timeLimit)
                .toString();
    }
}
