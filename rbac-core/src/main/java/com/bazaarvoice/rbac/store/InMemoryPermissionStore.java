package com.bazaarvoice.rbac.store;

import com.bazaarvoice.rbac.dependency.DependencyRuleSet;
import com.bazaarvoice.rbac.dependency.PermissionDependencyRule;
import com.bazaarvoice.rbac.permissions.ResourcePermission;
import com.google.common.base.Throwables;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.SetMultimap;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Simple in-memory implementation of a {@link PermissionStore} which also supports writes.
 * <p>
 * Every write notifies the registered {@link StoreChangeListener}s before returning, outside of the store's own
 * lock.  If a listener fails the write has still been applied; the first listener exception is propagated to the
 * writer and any others are logged.
 */
public class InMemoryPermissionStore implements PermissionStore, StoreChangeNotifier {

    private static final Logger _log = LoggerFactory.getLogger(InMemoryPermissionStore.class);

    private final Object _lock = new Object();
    private final Map<String, Role> _rolesById = Maps.newHashMap();
    private final SetMultimap<String, ResourcePermission> _permissionsByRole = HashMultimap.create();
    private final ListMultimap<String, UserRoleAssignment> _assignmentsByUser = ArrayListMultimap.create();
    private final Set<String> _superAdmins = Sets.newHashSet();
    private final Map<String, ResourceOwner> _resourceOwners = Maps.newHashMap();
    private List<PermissionDependencyRule> _dependencyRules = ImmutableList.of();
    private final List<StoreChangeListener> _listeners = Lists.newCopyOnWriteArrayList();

    public InMemoryPermissionStore() {
        // empty
    }

    public InMemoryPermissionStore(List<PermissionDependencyRule> dependencyRules) {
        DependencyRuleSet.compile(dependencyRules);
        _dependencyRules = ImmutableList.copyOf(dependencyRules);
    }

    @Override
    public void addListener(StoreChangeListener listener) {
        _listeners.add(checkNotNull(listener, "listener"));
    }

    // Reads

    @Override
    public List<UserRoleAssignment> getAssignmentsForUser(String userId, String tenantId) {
        synchronized (_lock) {
            return _assignmentsByUser.get(userId).stream()
                    .filter(assignment -> assignment.getTenantId().equals(tenantId))
                    .collect(ImmutableList.toImmutableList());
        }
    }

    @Override
    public Set<ResourcePermission> getPermissionsForRole(String roleId) {
        synchronized (_lock) {
            return ImmutableSet.copyOf(_permissionsByRole.get(roleId));
        }
    }

    @Override
    public List<PermissionDependencyRule> getDependencyRules() {
        synchronized (_lock) {
            return _dependencyRules;
        }
    }

    @Override
    public boolean isSuperAdmin(String userId) {
        synchronized (_lock) {
            return _superAdmins.contains(userId);
        }
    }

    @Override
    public Optional<ResourceOwner> getResourceOwningEntity(String resourceType, String resourceId) {
        synchronized (_lock) {
            return Optional.ofNullable(_resourceOwners.get(resourceKey(resourceType, resourceId)));
        }
    }

    @Nullable
    public Role getRole(String roleId) {
        synchronized (_lock) {
            return _rolesById.get(roleId);
        }
    }

    // Writes

    public Role createRole(Role role) {
        checkNotNull(role, "role");
        synchronized (_lock) {
            if (_rolesById.containsKey(role.getId())) {
                throw new RoleExistsException(role.getId());
            }
            _rolesById.put(role.getId(), role);
        }
        _log.debug("Created role {}", role);
        return role;
    }

    /**
     * Deletes the role along with its permissions and every assignment of it.
     */
    public void deleteRole(String roleId) {
        List<StoreChangeEvent> events = Lists.newArrayList();
        synchronized (_lock) {
            if (_rolesById.remove(roleId) == null) {
                throw new RoleNotFoundException(roleId);
            }
            _permissionsByRole.removeAll(roleId);
            Set<String> affectedUsers = Sets.newHashSet();
            _assignmentsByUser.values().removeIf(assignment -> {
                if (assignment.getRoleId().equals(roleId)) {
                    affectedUsers.add(assignment.getUserId());
                    return true;
                }
                return false;
            });
            events.add(StoreChangeEvent.rolePermissionsChanged(this, roleId));
            for (String userId : affectedUsers) {
                events.add(StoreChangeEvent.assignmentChanged(this, userId, roleId));
            }
        }
        notifyListeners(events);
    }

    public void grantPermission(String roleId, ResourcePermission permission) {
        checkNotNull(permission, "permission");
        boolean changed;
        synchronized (_lock) {
            requireRole(roleId);
            changed = _permissionsByRole.put(roleId, permission);
        }
        if (changed) {
            notifyListeners(ImmutableList.of(StoreChangeEvent.rolePermissionsChanged(this, roleId)));
        }
    }

    public void revokePermission(String roleId, ResourcePermission permission) {
        checkNotNull(permission, "permission");
        boolean changed;
        synchronized (_lock) {
            requireRole(roleId);
            changed = _permissionsByRole.remove(roleId, permission);
        }
        if (changed) {
            notifyListeners(ImmutableList.of(StoreChangeEvent.rolePermissionsChanged(this, roleId)));
        }
    }

    /**
     * Assigns a role to a user.  An existing assignment of the same role in the same tenant and entity is replaced,
     * which is how an expiration is changed.
     */
    public void assignRole(UserRoleAssignment assignment) {
        checkNotNull(assignment, "assignment");
        synchronized (_lock) {
            Role role = requireRole(assignment.getRoleId());
            if (!role.isGlobal() && !role.getTenantId().equals(assignment.getTenantId())) {
                throw new RoleTenantMismatchException(role.getId(), assignment.getTenantId());
            }
            List<UserRoleAssignment> existing = _assignmentsByUser.get(assignment.getUserId());
            existing.removeIf(assignment::isSameGrant);
            existing.add(assignment);
        }
        notifyListeners(ImmutableList.of(
                StoreChangeEvent.assignmentChanged(this, assignment.getUserId(), assignment.getRoleId())));
    }

    public void revokeRole(String userId, String roleId, String tenantId, @Nullable String entityId) {
        boolean changed;
        synchronized (_lock) {
            changed = _assignmentsByUser.get(userId).removeIf(assignment ->
                    assignment.getRoleId().equals(roleId) &&
                    assignment.getTenantId().equals(tenantId) &&
                    Objects.equals(assignment.getEntityId(), entityId));
        }
        if (changed) {
            notifyListeners(ImmutableList.of(StoreChangeEvent.assignmentChanged(this, userId, roleId)));
        }
    }

    public void setSuperAdmin(String userId, boolean superAdmin) {
        checkNotNull(userId, "userId");
        boolean changed;
        synchronized (_lock) {
            changed = superAdmin ? _superAdmins.add(userId) : _superAdmins.remove(userId);
        }
        if (changed) {
            notifyListeners(ImmutableList.of(StoreChangeEvent.superAdminChanged(this, userId)));
        }
    }

    /**
     * Registers or moves a resource.  Moving an existing resource to another owner publishes a change event, since
     * cached decisions about it may no longer hold.  A new resource needs none: missing resources are never cached.
     */
    public void registerResource(String resourceType, String resourceId, ResourceOwner owner) {
        checkNotNull(owner, "owner");
        ResourceOwner previous;
        synchronized (_lock) {
            previous = _resourceOwners.put(resourceKey(resourceType, resourceId), owner);
        }
        if (previous != null && !previous.equals(owner)) {
            notifyListeners(ImmutableList.of(StoreChangeEvent.resourceOwnerChanged(this, resourceType, resourceId)));
        }
    }

    public void removeResource(String resourceType, String resourceId) {
        ResourceOwner previous;
        synchronized (_lock) {
            previous = _resourceOwners.remove(resourceKey(resourceType, resourceId));
        }
        if (previous != null) {
            notifyListeners(ImmutableList.of(StoreChangeEvent.resourceOwnerChanged(this, resourceType, resourceId)));
        }
    }

    /**
     * Replaces the dependency rule table.  The rules are compiled first, so a cyclic or malformed table is
     * rejected with {@link com.bazaarvoice.rbac.dependency.DependencyConfigurationException} and the current
     * table is kept.
     */
    public void replaceDependencyRules(Collection<PermissionDependencyRule> rules) {
        DependencyRuleSet.compile(rules);
        synchronized (_lock) {
            _dependencyRules = ImmutableList.copyOf(rules);
        }
        notifyListeners(ImmutableList.of(StoreChangeEvent.dependencyRulesChanged(this)));
    }

    private Role requireRole(String roleId) {
        Role role = _rolesById.get(checkNotNull(roleId, "roleId"));
        if (role == null) {
            throw new RoleNotFoundException(roleId);
        }
        return role;
    }

    private static String resourceKey(String resourceType, String resourceId) {
        return checkNotNull(resourceType, "resourceType") + ResourcePermission.SEPARATOR + checkNotNull(resourceId, "resourceId");
    }

    private void notifyListeners(List<StoreChangeEvent> events) {
        // Call all the listeners.  If any fail, propagate an exception so the writer discovers that caches may
        // not have observed the change.
        Throwable first = null;
        for (StoreChangeEvent event : events) {
            for (StoreChangeListener listener : _listeners) {
                try {
                    listener.storeChanged(event);
                } catch (Throwable t) {
                    if (first == null) {
                        first = t;
                    } else {
                        _log.error("Exception handling store change event: {}", event, t);
                    }
                }
            }
        }
        if (first != null) {
            Throwables.throwIfUnchecked(first);
            throw new RuntimeException(first);
        }
    }
}
