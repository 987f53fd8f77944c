package com.example.authz.model;

/**
 * Privilege level a user holds within one specific store.
 */
public enum StoreRole {
    ADMIN,
    MODERATOR,
    GUEST
}
