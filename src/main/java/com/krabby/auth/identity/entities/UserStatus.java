package com.krabby.auth.identity.entities;

/**
 * Presence of a user. Informational only; authentication never reads it.
 */
public enum UserStatus {
    ONLINE,
    OFFLINE,
}
