package dev.callguard.config;

/**
 * Backing store selected when a cache layer is constructed.
 */
public enum StoreType {
    IN_MEMORY,
    EXTERNAL
}
