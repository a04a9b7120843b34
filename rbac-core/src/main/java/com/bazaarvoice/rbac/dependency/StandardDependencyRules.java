package com.bazaarvoice.rbac.dependency;

import com.bazaarvoice.rbac.api.Action;
import com.bazaarvoice.rbac.permissions.ResourcePermission;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The action hierarchy shipped by default.  Every rule is a template, so it applies to each resource type
 * independently:
 * <ul>
 *     <li>Manage implies Create, Update, Delete and View, and each of the "Any" actions</li>
 *     <li>Delete implies Update, which implies View</li>
 *     <li>DeleteAny implies UpdateAny, which implies ViewAny</li>
 *     <li>each "Any" action implies its instance action</li>
 * </ul>
 */
public final class StandardDependencyRules {

    private static final List<PermissionDependencyRule> RULES = ImmutableList.of(
            PermissionDependencyRule.any("manage-implies-instance-actions", 100, any(Action.MANAGE),
                    any(Action.CREATE), any(Action.UPDATE), any(Action.DELETE), any(Action.VIEW)),
            PermissionDependencyRule.any("manage-implies-any-actions", 100, any(Action.MANAGE),
                    any(Action.VIEW_ANY), any(Action.UPDATE_ANY), any(Action.DELETE_ANY)),
            PermissionDependencyRule.any("delete-implies-update", 50, any(Action.DELETE), any(Action.UPDATE)),
            PermissionDependencyRule.any("update-implies-view", 50, any(Action.UPDATE), any(Action.VIEW)),
            PermissionDependencyRule.any("delete-any-implies-update-any", 40, any(Action.DELETE_ANY), any(Action.UPDATE_ANY)),
            PermissionDependencyRule.any("update-any-implies-view-any", 40, any(Action.UPDATE_ANY), any(Action.VIEW_ANY)),
            PermissionDependencyRule.any("delete-any-implies-delete", 30, any(Action.DELETE_ANY), any(Action.DELETE)),
            PermissionDependencyRule.any("update-any-implies-update", 30, any(Action.UPDATE_ANY), any(Action.UPDATE)),
            PermissionDependencyRule.any("view-any-implies-view", 30, any(Action.VIEW_ANY), any(Action.VIEW)));

    private StandardDependencyRules() {
        // empty
    }

    public static List<PermissionDependencyRule> rules() {
        return RULES;
    }

    private static ResourcePermission any(Action action) {
        return new ResourcePermission(ResourcePermission.ANY_RESOURCE_TYPE, action);
    }
}
