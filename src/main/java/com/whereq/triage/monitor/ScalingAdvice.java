package com.whereq.triage.monitor;

/**
 * Worker scaling suggestion for a queue. Scaling itself happens at the infrastructure level.
 */
public enum ScalingAdvice {
    SCALE_UP,
    SCALE_DOWN,
    NONE
}
