package com.example.authz.entity;

/**
 * Entity owned by a single user (an order, a review, a cart).
 */
public interface UserOwned {

    String ownerId();
}
