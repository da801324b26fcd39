package de.bsommerfeld.threadline.enrichment;

/**
 * Lifecycle of a frontier URI within one session:
 * {@code UNKNOWN → REQUESTED → RESOLVED | FAILED}.
 */
public enum FetchState {

    UNKNOWN,
    REQUESTED,
    RESOLVED,
    FAILED
}
