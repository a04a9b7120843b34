package com.bazaarvoice.rbac.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The fixed set of actions a permission can grant.  Instance-scoped actions ({@link #VIEW}, {@link #UPDATE},
 * {@link #DELETE}) apply to a single resource and each has an "Any" variant which applies to every resource of
 * the type within the caller's scope.  {@link #CREATE} and {@link #MANAGE} are type-level actions.
 */
public enum Action {
    CREATE("Create"),
    VIEW("View"),
    VIEW_ANY("ViewAny"),
    UPDATE("Update"),
    UPDATE_ANY("UpdateAny"),
    DELETE("Delete"),
    DELETE_ANY("DeleteAny"),
    MANAGE("Manage");

    private final String _name;

    Action(String name) {
        _name = name;
    }

    @JsonValue
    public String getName() {
        return _name;
    }

    /** True for View, Update and Delete, which need a resource instance to be meaningful. */
    public boolean isInstanceScoped() {
        return this == VIEW || this == UPDATE || this == DELETE;
    }

    /** Returns the "Any" form of an instance-scoped action, otherwise the action itself. */
    public Action anyVariant() {
        switch (this) {
            case VIEW:
                return VIEW_ANY;
            case UPDATE:
                return UPDATE_ANY;
            case DELETE:
                return DELETE_ANY;
            default:
                return this;
        }
    }

    @JsonCreator
    public static Action fromString(String name) {
        checkNotNull(name, "name");
        String normalized = name.trim().replace("_", "");
        for (Action action : values()) {
            if (action._name.equalsIgnoreCase(normalized)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown action: " + name);
    }

    @Override
    public String toString() {
        return _name;
    }
}
