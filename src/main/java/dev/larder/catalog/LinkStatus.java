package dev.larder.catalog;

/**
 * How a discovered recipe link relates to earlier discovery and import runs.
 */
public enum LinkStatus {
    /** Never shown before. */
    FRESH,
    /** Shown in an earlier discovery run but not imported. */
    SEEN,
    /** Already imported. */
    IMPORTED
}
