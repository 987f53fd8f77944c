package com.example.authz.entity;

/**
 * Entity belonging to a store. Admins of that store are treated as owners.
 */
public interface StoreOwned {

    String storeId();
}
