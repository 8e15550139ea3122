package com.eyelevel.uploadengine.model;

/**
 * How a provider expects data to be synchronized. Carried as configuration; the engine
 * itself uploads whatever it is handed.
 */
public enum SyncMode {
    REAL_TIME,
    BATCH,
    OFFLINE_FIRST,
    BACKUP_ONLY
}
