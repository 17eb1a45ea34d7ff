package com.relationsim.relationship.persistence;

/**
 * Outcome of {@link PersistenceLayer#load(String)}. Every status except {@link #LOADED}
 * means the default state was returned.
 */
public enum LoadStatus {
    LOADED,
    DEFAULTED_MISSING,
    DEFAULTED_CORRUPT,
    DEFAULTED_IO_ERROR
}
