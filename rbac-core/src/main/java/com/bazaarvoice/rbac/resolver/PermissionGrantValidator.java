package com.bazaarvoice.rbac.resolver;

import com.bazaarvoice.rbac.api.Action;
import com.bazaarvoice.rbac.api.CheckDeadline;
import com.bazaarvoice.rbac.cache.EffectivePermissions;
import com.bazaarvoice.rbac.permissions.ResourcePermission;
import com.bazaarvoice.rbac.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Decides whether a user may grant a permission to someone else.  A grantor must
 * <ul>
 *     <li>hold {@code roles|Manage} in the scope they act in,</li>
 *     <li>hold the permission being granted, directly or through a dependency rule, and</li>
 *     <li>hold both tenant-wide when granting into a different entity or tenant-wide.</li>
 * </ul>
 * Super admins may grant anything.  Store errors and timeouts make the grant invalid.
 */
public class PermissionGrantValidator {

    private static final Logger _log = LoggerFactory.getLogger(PermissionGrantValidator.class);

    public static final String ROLES_RESOURCE_TYPE = "roles";

    private static final ResourcePermission MANAGE_ROLES = new ResourcePermission(ROLES_RESOURCE_TYPE, Action.MANAGE);

    private final DefaultPermissionChecker _checker;
    private final Clock _clock;
    private final Duration _timeout;

    public PermissionGrantValidator(DefaultPermissionChecker checker, Clock clock, Duration timeout) {
        _checker = checkNotNull(checker, "checker");
        _clock = checkNotNull(clock, "clock");
        _timeout = checkNotNull(timeout, "timeout");
    }

    /**
     * @param grantorEntityId entity the grantor is acting in, null when acting tenant-wide
     * @param granteeEntityId entity the grant applies to, null for a tenant-wide grant
     */
    public GrantValidation validate(String grantorId, String tenantId, @Nullable String grantorEntityId,
                                    ResourcePermission permission, @Nullable String granteeEntityId) {
        checkNotNull(grantorId, "grantorId");
        checkNotNull(tenantId, "tenantId");
        checkNotNull(permission, "permission");
        CheckDeadline deadline = CheckDeadline.after(_clock, _timeout);

        try {
            if (_checker.isSuperAdmin(grantorId, deadline)) {
                return GrantValidation.valid();
            }

            EffectivePermissions grantorScope = _checker.getEffectivePermissions(grantorId, tenantId, grantorEntityId, deadline);
            if (!holds(grantorScope, MANAGE_ROLES)) {
                return GrantValidation.invalid("Grantor lacks " + MANAGE_ROLES);
            }

            EffectivePermissions granting = grantorScope;
            if (!Objects.equals(grantorEntityId, granteeEntityId)) {
                granting = _checker.getEffectivePermissions(grantorId, tenantId, null, deadline);
                if (!holds(granting, MANAGE_ROLES)) {
                    return GrantValidation.invalid("Granting outside the grantor's entity requires a tenant-wide assignment");
                }
            }

            if (!holds(granting, permission)) {
                return GrantValidation.invalid("Grantor does not hold " + permission);
            }
            return GrantValidation.valid();

        } catch (StoreUnavailableException e) {
            _log.warn("Permission store unavailable validating grant of {} by {}", permission, grantorId, e);
            return GrantValidation.invalid("Permission store unavailable");
        } catch (CheckTimeoutException e) {
            return GrantValidation.invalid("Timed out validating grant");
        }
    }

    private static boolean holds(EffectivePermissions effective, ResourcePermission permission) {
        return effective.getStatus() == EffectivePermissions.Status.IN_SCOPE &&
                (effective.grantsDirectly(permission) || effective.grantsThroughDependency(permission));
    }
}
