package com.dive.orchestrator.model;

/**
 * What a rollback undoes for the phase that failed.
 *
 *   STOP     : halt and remove the instance's running service containers
 *   CONFIG   : restore the last checkpoint's configuration snapshot
 *   COMPLETE : STOP followed by CONFIG
 */
public enum RollbackStrategy {
    STOP,
    CONFIG,
    COMPLETE;

    public boolean stopsServices()    { return this == STOP || this == COMPLETE; }
    public boolean restoresConfig()   { return this == CONFIG || this == COMPLETE; }
}
