package com.example.authz.policy;

import com.example.authz.common.util.StringSanitizer;
import com.example.authz.entity.EntityOwnership;
import com.example.authz.model.AccessDecision;
import com.example.authz.model.DenialReason;
import com.example.authz.model.EntityOwnerConfig;
import com.example.authz.model.PermissionScope;
import com.example.authz.model.PolicyEntry;
import com.example.authz.model.Principal;
import com.example.authz.model.StoreRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static com.example.authz.model.GuardStageNames.ENTITY_OWNERSHIP_CHECK;
import static com.example.authz.model.GuardStageNames.PERMISSION_CHECK;
import static com.example.authz.model.GuardStageNames.SITE_ADMIN_CHECK;
import static com.example.authz.model.GuardStageNames.STORE_ROLE_CHECK;

/**
 * Pure allow/deny decisions over a principal whose trust flags are already computed.
 *
 * <p>No I/O happens here: the guard stages load site-admin status, store roles and
 * entities first, then ask the engine. Every check treats a null policy, or a
 * policy without a constraint of its kind, as allow.
 */
@Slf4j
public class PolicyEngine {

    /**
     * Site-admin gate: authentication and {@code adminRole}. A store role never
     * satisfies an admin constraint.
     */
    public AccessDecision checkAdminRole(Principal principal, @Nullable PolicyEntry policy) {
        if (policy == null) {
            return AccessDecision.allow();
        }
        if (!policy.hasAdminConstraint() && !policy.hasStoreRoleConstraint() && !policy.requiresAuthentication()) {
            return AccessDecision.allow();
        }
        if (principal == null || !principal.active()) {
            return AccessDecision.deny(SITE_ADMIN_CHECK, DenialReason.AUTHENTICATION_REQUIRED,
                    "Authentication required");
        }
        if (policy.hasAdminConstraint() && !principal.isSiteAdmin()) {
            log.debug("User {} lacks admin role {}", principal.id(), policy.adminRole());
            return AccessDecision.deny(SITE_ADMIN_CHECK, DenialReason.ADMIN_REQUIRED,
                    "Admin role " + policy.adminRole() + " required");
        }
        return AccessDecision.allow();
    }

    /**
     * Store-role gate. {@code storeId} is the id taken from the route; the
     * principal's store roles must already be loaded.
     */
    public AccessDecision checkStoreRoles(Principal principal, @Nullable PolicyEntry policy, @Nullable String storeId) {
        if (policy == null || !policy.hasStoreRoleConstraint()) {
            return AccessDecision.allow();
        }
        if (principal.isSiteAdmin()) {
            return AccessDecision.allow();
        }
        Optional<StoreRole> role = principal.roleInStore(storeId);
        if (role.isPresent() && policy.storeRoles().contains(role.get())) {
            return AccessDecision.allow();
        }
        log.debug("User {} has role {} in store {}, required one of {}",
                principal.id(), role.orElse(null), StringSanitizer.forLog(storeId), policy.storeRoles());
        return AccessDecision.deny(STORE_ROLE_CHECK, DenialReason.STORE_ROLE_REQUIRED,
                "One of " + policy.storeRoles() + " required in store " + StringSanitizer.forLog(storeId));
    }

    /**
     * Ownership gate over an already loaded entity ({@code null} when none was found).
     */
    public AccessDecision checkOwnership(Principal principal, @Nullable PolicyEntry policy, @Nullable Object entity) {
        if (policy == null || !policy.hasOwnershipConstraint()) {
            return AccessDecision.allow();
        }
        if (principal.isSiteAdmin()) {
            return AccessDecision.allow();
        }
        EntityOwnerConfig config = policy.entityOwner();
        if (entity == null) {
            if (config.allowMissingEntity()) {
                return AccessDecision.deny(ENTITY_OWNERSHIP_CHECK, DenialReason.NOT_OWNER,
                        "No " + config.lookup() + " entity to own");
            }
            return AccessDecision.deny(ENTITY_OWNERSHIP_CHECK, DenialReason.ENTITY_NOT_FOUND,
                    "Entity not found via " + config.lookup());
        }
        if (isOwner(principal, entity)) {
            return AccessDecision.allow();
        }
        log.debug("User {} does not own {} entity", principal.id(), config.lookup());
        return AccessDecision.deny(ENTITY_OWNERSHIP_CHECK, DenialReason.NOT_OWNER,
                "Caller does not own the " + config.lookup() + " entity");
    }

    /**
     * Owner of the entity, or admin of the store the entity belongs to.
     */
    public boolean isOwner(Principal principal, Object entity) {
        Optional<String> ownerId = EntityOwnership.ownerIdOf(entity);
        if (ownerId.isPresent() && ownerId.get().equals(principal.id())) {
            return true;
        }
        return EntityOwnership.storeIdOf(entity)
                .map(storeId -> principal.hasRoleInStore(storeId, StoreRole.ADMIN))
                .orElse(false);
    }

    /**
     * Permission-scope gate. Site admins and admins of the route's store bypass it.
     */
    public AccessDecision checkPermissions(Principal principal, @Nullable PolicyEntry policy, @Nullable String storeId) {
        if (policy == null || !policy.hasScopeConstraint()) {
            return AccessDecision.allow();
        }
        if (principal.isSiteAdmin()) {
            return AccessDecision.allow();
        }
        if (storeId != null && principal.hasRoleInStore(storeId, StoreRole.ADMIN)) {
            return AccessDecision.allow();
        }
        Set<PermissionScope> missing = principal.missingScopes(policy.requiredScopes());
        if (missing.isEmpty()) {
            return AccessDecision.allow();
        }
        Set<String> missingValues = new TreeSet<>();
        missing.forEach(scope -> missingValues.add(scope.value()));
        log.debug("User {} missing permissions {}", principal.id(), missingValues);
        return AccessDecision.deny(PERMISSION_CHECK, DenialReason.MISSING_PERMISSIONS,
                "Missing permissions", missingValues);
    }

    /**
     * Runs every check in chain order and returns the first denial.
     *
     * @param storeId the route's store id, if any
     * @param entity  the loaded entity for ownership-scoped routes, if any
     */
    public AccessDecision evaluate(Principal principal, @Nullable PolicyEntry policy,
                                   @Nullable String storeId, @Nullable Object entity) {
        AccessDecision decision = checkAdminRole(principal, policy);
        if (decision.isDenied()) {
            return decision;
        }
        decision = checkStoreRoles(principal, policy, storeId);
        if (decision.isDenied()) {
            return decision;
        }
        decision = checkOwnership(principal, policy, entity);
        if (decision.isDenied()) {
            return decision;
        }
        return checkPermissions(principal, policy, storeId);
    }
}
