package com.hting007.logiq.model;

public enum AnomalyKind {
    /** Observed count above the baseline threshold. */
    FREQUENCY,
    /** First occurrence of a template outside the learned set. */
    PATTERN
}
