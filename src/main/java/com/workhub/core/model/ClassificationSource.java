package com.workhub.core.model;

/**
 * Which classifier path produced the accepted result.
 */
public enum ClassificationSource {
    MODEL,
    RULES
}
