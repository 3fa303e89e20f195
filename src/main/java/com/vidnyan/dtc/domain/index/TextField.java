package com.vidnyan.dtc.domain.index;

/**
 * Record fields that feed the token index, in descending ranking order.
 */
public enum TextField {
    DESCRIPTION,
    CAUSE,
    ACTION
}
