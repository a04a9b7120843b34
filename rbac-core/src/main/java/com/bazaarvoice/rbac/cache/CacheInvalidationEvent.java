package com.bazaarvoice.rbac.cache;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import java.util.EventObject;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Published after the {@link PermissionCache} drops entries.  {@code subjectId} is the user or role id for
 * {@link InvalidationScope#USER} and {@link InvalidationScope#ROLE} invalidations and null for
 * {@link InvalidationScope#ALL}.
 */
public class CacheInvalidationEvent extends EventObject {
    private final InvalidationScope _scope;
    private final String _subjectId;
    private final Set<String> _affectedUsers;
    private final int _entriesInvalidated;

    public CacheInvalidationEvent(Object source, InvalidationScope scope, @Nullable String subjectId,
                                  Set<String> affectedUsers, int entriesInvalidated) {
        super(source);
        _scope = requireNonNull(scope, "scope");
        _subjectId = subjectId;
        _affectedUsers = ImmutableSet.copyOf(requireNonNull(affectedUsers, "affectedUsers"));
        _entriesInvalidated = entriesInvalidated;
    }

    public InvalidationScope getScope() {
        return _scope;
    }

    @Nullable
    public String getSubjectId() {
        return _subjectId;
    }

    public Set<String> getAffectedUsers() {
        return _affectedUsers;
    }

    public int getEntriesInvalidated() {
        return _entriesInvalidated;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("scope", _scope)
                .add("subjectId", _subjectId)
                .add("affectedUsers", _affectedUsers)
                .add("entriesInvalidated", _entriesInvalidated)
                .toString();
    }
}
