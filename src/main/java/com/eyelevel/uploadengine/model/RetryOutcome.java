package com.eyelevel.uploadengine.model;

/**
 * Terminal states of one retry sequence against a single provider.
 */
public enum RetryOutcome {
    SUCCESS,
    EXHAUSTED
}
