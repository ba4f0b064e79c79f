package net.kairos.core.service;

public enum FiringSource {
    /** Due tick of an armed trigger. */
    SCHEDULED,
    /** Run-now request; leaves the job's schedule alone. */
    MANUAL
}
