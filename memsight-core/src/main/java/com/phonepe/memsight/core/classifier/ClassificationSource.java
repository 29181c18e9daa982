package com.phonepe.memsight.core.classifier;

/**
 * Which layer of the classifier produced a result
 */
public enum ClassificationSource {
    RULES,
    MODEL,
    FALLBACK,
}
