package com.bazaarvoice.rbac.resolver;

import com.bazaarvoice.rbac.TestClocks;
import com.bazaarvoice.rbac.audit.DiscardingAuditEmitter;
import com.bazaarvoice.rbac.boundary.EntityBoundaryValidator;
import com.bazaarvoice.rbac.cache.PermissionCache;
import com.bazaarvoice.rbac.config.CacheConfiguration;
import com.bazaarvoice.rbac.dependency.DependencyResolver;
import com.bazaarvoice.rbac.permissions.ResourcePermission;
import com.bazaarvoice.rbac.store.InMemoryPermissionStore;
import com.bazaarvoice.rbac.store.PermissionStore;
import com.bazaarvoice.rbac.store.Role;
import com.bazaarvoice.rbac.store.StoreUnavailableException;
import com.bazaarvoice.rbac.store.UserRoleAssignment;
import com.codahale.metrics.MetricRegistry;
import com.google.common.util.concurrent.MoreExecutors;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class PermissionGrantValidatorTest {

    private static final ResourcePermission PROJECTS_UPDATE = ResourcePermission.parse("projects|Update");
    private static final ResourcePermission PROJECTS_VIEW = ResourcePermission.parse("projects|View");
    private static final ResourcePermission PROJECTS_DELETE = ResourcePermission.parse("projects|Delete");

    private Clock _clock;
    private InMemoryPermissionStore _store;
    private PermissionCache _cache;
    private PermissionGrantValidator _validator;

    @BeforeMethod
    public void setUp() {
        _clock = TestClocks.mutable(new AtomicLong(1_700_000_000_000L));
        _store = new InMemoryPermissionStore();
        _store.createRole(new Role("project-admin", "Project admin", null));
        _store.grantPermission("project-admin", ResourcePermission.parse("roles|Manage"));
        _store.grantPermission("project-admin", PROJECTS_UPDATE);
        _store.createRole(new Role("project-editor", "Project editor", null));
        _store.grantPermission("project-editor", PROJECTS_UPDATE);

        _store.assignRole(new UserRoleAssignment("tenant-admin", "project-admin", "acme", null));
        _store.assignRole(new UserRoleAssignment("east-admin", "project-admin", "acme", "east"));
        _store.assignRole(new UserRoleAssignment("editor", "project-editor", "acme", null));
        _store.setSuperAdmin("root", true);

        _cache = new PermissionCache(new CacheConfiguration(), _clock, new MetricRegistry());
        _validator = new PermissionGrantValidator(newChecker(_store), _clock, Duration.ofSeconds(5));
    }

    @AfterMethod
    public void tearDown() {
        _cache.close();
    }

    private DefaultPermissionChecker newChecker(PermissionStore store) {
        return new DefaultPermissionChecker(store, _cache, DependencyResolver.withStandardRules(),
                new EntityBoundaryValidator(_clock), new DiscardingAuditEmitter(), MoreExecutors.newDirectExecutorService(),
                _clock, Duration.ofSeconds(5), new MetricRegistry());
    }

    @Test
    public void testGrantorHoldingPermission() {
        assertTrue(_validator.validate("tenant-admin", "acme", null, PROJECTS_UPDATE, null).isValid());
        // Held through the Update implies View rule
        assertTrue(_validator.validate("tenant-admin", "acme", null, PROJECTS_VIEW, "east").isValid());
    }

    @Test
    public void testGrantorLackingPermission() {
        GrantValidation validation = _validator.validate("tenant-admin", "acme", null, PROJECTS_DELETE, null);
        assertFalse(validation.isValid());
        assertEquals(validation.getReason(), "Grantor does not hold projects|Delete");
    }

    @Test
    public void testGrantorWithoutManageRoles() {
        GrantValidation validation = _validator.validate("editor", "acme", null, PROJECTS_UPDATE, null);
        assertFalse(validation.isValid());
        assertEquals(validation.getReason(), "Grantor lacks roles|Manage");
    }

    @Test
    public void testEntityAdminStaysInsideEntity() {
        assertTrue(_validator.validate("east-admin", "acme", "east", PROJECTS_UPDATE, "east").isValid());
        assertFalse(_validator.validate("east-admin", "acme", "east", PROJECTS_UPDATE, "west").isValid());
        assertFalse(_validator.validate("east-admin", "acme", "east", PROJECTS_UPDATE, null).isValid());
    }

    @Test
    public void testNoGrantsAcrossTenants() {
        assertFalse(_validator.validate("tenant-admin", "globex", null, PROJECTS_UPDATE, null).isValid());
    }

    @Test
    public void testSuperAdminMayGrantAnything() {
        assertTrue(_validator.validate("root", "globex", null, PROJECTS_DELETE, "anywhere").isValid());
    }

    @Test
    public void testStoreFailureInvalidatesGrant() {
        PermissionStore store = mock(PermissionStore.class);
        when(store.isSuperAdmin("tenant-admin")).thenThrow(new StoreUnavailableException("connection refused"));
        PermissionGrantValidator validator = new PermissionGrantValidator(newChecker(store), _clock, Duration.ofSeconds(5));

        GrantValidation validation = validator.validate("tenant-admin", "acme", null, PROJECTS_UPDATE, null);
        assertFalse(validation.isValid());
        assertEquals(validation.getReason(), "Permission store unavailable");
    }
}
