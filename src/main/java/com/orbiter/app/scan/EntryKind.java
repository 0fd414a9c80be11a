package com.orbiter.app.scan;

/**
 * Shape of a scanned entry. Only {@link #DIRECTORY} carries children;
 * a {@link #PACKAGE} is a directory the OS presents as one file, so it is
 * sized recursively but kept as a leaf.
 */
public enum EntryKind {
    FILE,
    DIRECTORY,
    PACKAGE
}
