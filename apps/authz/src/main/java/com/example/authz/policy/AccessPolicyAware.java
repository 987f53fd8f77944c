package com.example.authz.policy;

/**
 * Implemented by controllers that declare their access policies in a static
 * {@link AccessPolicyTable} rather than (or in addition to) annotations.
 */
public interface AccessPolicyAware {

    AccessPolicyTable accessPolicies();
}
