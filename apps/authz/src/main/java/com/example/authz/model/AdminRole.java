package com.example.authz.model;

/**
 * Platform-wide administrative roles. Independent of any store.
 */
public enum AdminRole {
    ADMIN
}
