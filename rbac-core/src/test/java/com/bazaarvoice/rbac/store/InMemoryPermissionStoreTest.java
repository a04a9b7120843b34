package com.bazaarvoice.rbac.store;

import com.bazaarvoice.rbac.dependency.DependencyConfigurationException;
import com.bazaarvoice.rbac.dependency.PermissionDependencyRule;
import com.bazaarvoice.rbac.permissions.ResourcePermission;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class InMemoryPermissionStoreTest {

    private static final ResourcePermission PROJECTS_VIEW = ResourcePermission.parse("projects|View");

    private InMemoryPermissionStore _store;
    private List<StoreChangeEvent> _events;

    @BeforeMethod
    public void setUp() {
        _store = new InMemoryPermissionStore();
        _events = Lists.newCopyOnWriteArrayList();
        _store.addListener(_events::add);
        _store.createRole(new Role("viewer", "Viewer", null));
        _store.createRole(new Role("acme-auditor", "Auditor", "acme"));
    }

    @Test
    public void testGrantAndRevokePermission() {
        _store.grantPermission("viewer", PROJECTS_VIEW);
        assertEquals(_store.getPermissionsForRole("viewer"), ImmutableSet.of(PROJECTS_VIEW));
        assertEquals(_events.size(), 1);
        assertEquals(_events.get(0).getType(), StoreChangeType.ROLE_PERMISSION);
        assertEquals(_events.get(0).getRoleId(), "viewer");

        // Granting twice is a no-op
        _store.grantPermission("viewer", PROJECTS_VIEW);
        assertEquals(_events.size(), 1);

        _store.revokePermission("viewer", PROJECTS_VIEW);
        assertTrue(_store.getPermissionsForRole("viewer").isEmpty());
        assertEquals(_events.size(), 2);
    }

    @Test
    public void testUnknownRole() {
        assertTrue(_store.getPermissionsForRole("nobody").isEmpty());
        assertNull(_store.getRole("nobody"));
        try {
            _store.grantPermission("nobody", PROJECTS_VIEW);
            fail();
        } catch (RoleNotFoundException e) {
            assertEquals(e.getRoleId(), "nobody");
        }
    }

    @Test(expectedExceptions = RoleExistsException.class)
    public void testDuplicateRole() {
        _store.createRole(new Role("viewer", "Another viewer", null));
    }

    @Test
    public void testAssignments() {
        _store.assignRole(new UserRoleAssignment("alice", "viewer", "acme", "east"));
        _store.assignRole(new UserRoleAssignment("alice", "viewer", "globex", null));

        assertEquals(_store.getAssignmentsForUser("alice", "acme"),
                ImmutableList.of(new UserRoleAssignment("alice", "viewer", "acme", "east")));
        assertEquals(_events.get(0).getType(), StoreChangeType.USER_ROLE_ASSIGNMENT);
        assertEquals(_events.get(0).getUserId(), "alice");

        _store.revokeRole("alice", "viewer", "acme", "east");
        assertTrue(_store.getAssignmentsForUser("alice", "acme").isEmpty());
        assertEquals(_store.getAssignmentsForUser("alice", "globex").size(), 1);
    }

    @Test
    public void testReassignReplacesExpiration() {
        _store.assignRole(new UserRoleAssignment("alice", "viewer", "acme", null, Instant.EPOCH));
        _store.assignRole(new UserRoleAssignment("alice", "viewer", "acme", null));

        List<UserRoleAssignment> assignments = _store.getAssignmentsForUser("alice", "acme");
        assertEquals(assignments.size(), 1);
        assertNull(assignments.get(0).getExpiresAt());
    }

    @Test(expectedExceptions = RoleTenantMismatchException.class)
    public void testTenantRoleOutsideItsTenant() {
        _store.assignRole(new UserRoleAssignment("alice", "acme-auditor", "globex", null));
    }

    @Test
    public void testDeleteRoleCascades() {
        _store.grantPermission("viewer", PROJECTS_VIEW);
        _store.assignRole(new UserRoleAssignment("alice", "viewer", "acme", null));
        _store.assignRole(new UserRoleAssignment("bob", "viewer", "acme", "east"));
        _events.clear();

        _store.deleteRole("viewer");

        assertNull(_store.getRole("viewer"));
        assertTrue(_store.getPermissionsForRole("viewer").isEmpty());
        assertTrue(_store.getAssignmentsForUser("alice", "acme").isEmpty());
        assertTrue(_store.getAssignmentsForUser("bob", "acme").isEmpty());
        assertEquals(_events.size(), 3);
        assertEquals(_events.get(0).getType(), StoreChangeType.ROLE_PERMISSION);
    }

    @Test
    public void testSuperAdmin() {
        assertFalse(_store.isSuperAdmin("root"));
        _store.setSuperAdmin("root", true);
        assertTrue(_store.isSuperAdmin("root"));
        assertEquals(_events.get(0).getType(), StoreChangeType.SUPER_ADMIN);
        _store.setSuperAdmin("root", false);
        assertFalse(_store.isSuperAdmin("root"));
        assertEquals(_events.size(), 2);
    }

    @Test
    public void testResources() {
        _store.registerResource("projects", "p1", new ResourceOwner("acme", "east"));
        assertEquals(_store.getResourceOwningEntity("projects", "p1"), Optional.of(new ResourceOwner("acme", "east")));
        assertEquals(_store.getResourceOwningEntity("tasks", "p1"), Optional.empty());
        // Nothing can be cached about a resource that did not exist, and re-registering the same owner changes nothing
        _store.registerResource("projects", "p1", new ResourceOwner("acme", "east"));
        assertTrue(_events.isEmpty());

        _store.registerResource("projects", "p1", new ResourceOwner("acme", "west"));
        assertEquals(_events.size(), 1);
        assertEquals(_events.get(0).getType(), StoreChangeType.RESOURCE_OWNER);
        assertEquals(_events.get(0).getResourceType(), "projects");
        assertEquals(_events.get(0).getResourceId(), "p1");

        _store.removeResource("projects", "p1");
        assertFalse(_store.getResourceOwningEntity("projects", "p1").isPresent());
        assertEquals(_events.size(), 2);

        _store.removeResource("projects", "p1");
        assertEquals(_events.size(), 2);
    }

    @Test
    public void testReplaceDependencyRules() {
        List<PermissionDependencyRule> rules = ImmutableList.of(
                PermissionDependencyRule.any("update-implies-view", 0, ResourcePermission.parse("projects|Update"), PROJECTS_VIEW));
        _store.replaceDependencyRules(rules);
        assertEquals(_store.getDependencyRules(), rules);
        assertEquals(_events.get(0).getType(), StoreChangeType.DEPENDENCY_RULES);

        try {
            _store.replaceDependencyRules(ImmutableList.of(
                    PermissionDependencyRule.any("self", 0, PROJECTS_VIEW, PROJECTS_VIEW)));
            fail();
        } catch (DependencyConfigurationException e) {
            // expected
        }
        assertEquals(_store.getDependencyRules(), rules);
        assertEquals(_events.size(), 1);
    }

    @Test
    public void testListenerFailurePropagatesAfterNotifyingOthers() {
        List<StoreChangeEvent> later = Lists.newArrayList();
        _store.addListener(event -> {
            throw new IllegalStateException("listener failed");
        });
        _store.addListener(later::add);

        try {
            _store.setSuperAdmin("root", true);
            fail();
        } catch (IllegalStateException e) {
            assertEquals(e.getMessage(), "listener failed");
        }
        assertEquals(later.size(), 1);
        assertTrue(_store.isSuperAdmin("root"));
    }
}
