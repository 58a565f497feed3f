package org.dataone.hashcheck.task;

/**
 * Stage of a task, attached to progress events and errors.
 */
public enum TaskPhase {
    SUBMISSION, DISCOVERY, PARSING, DIGESTING, VERIFYING, COMPARING, WRITING
}
