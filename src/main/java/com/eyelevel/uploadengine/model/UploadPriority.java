package com.eyelevel.uploadengine.model;

/**
 * Advisory priority tag of an upload request. Used for log context only.
 */
public enum UploadPriority {
    CRITICAL, HIGH, MEDIUM, LOW
}
