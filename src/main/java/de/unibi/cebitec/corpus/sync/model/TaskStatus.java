package de.unibi.cebitec.corpus.sync.model;

/**
 * Terminal states of a listed unit. {@link #SKIPPED} is decided before any task is created and is therefore never
 * the status of a {@link TaskResult}.
 */
public enum TaskStatus {
    DOWNLOADED,
    SKIPPED,
    FAILED
}
