package com.example.authz.model;

/**
 * Names reported in {@link AccessDecision#stage()} and in audit events.
 */
public final class GuardStageNames {

    public static final String TOKEN_VALIDATOR = "TokenValidator";
    public static final String SITE_ADMIN_CHECK = "SiteAdminCheck";
    public static final String STORE_ROLE_CHECK = "StoreRoleCheck";
    public static final String ENTITY_OWNERSHIP_CHECK = "EntityOwnershipCheck";
    public static final String PERMISSION_CHECK = "PermissionCheck";
    public static final String GUARD_CHAIN = "GuardChain";

    private GuardStageNames() {
        // Utility class
    }
}
