package org.ismcore.analysis.core;

/**
 * Handling of an identifier list whose length differs from the element count.
 *
 * <p>{@code TOLERATE} logs a warning and continues with the element count as
 * authoritative; positions without an identifier relate to nothing.</p>
 * <p>{@code STRICT} rejects the request before any matrix is built.</p>
 */
public enum IdentifierPolicy {
    TOLERATE,
    STRICT
}
