package com.property.distress.rules;

/**
 * The kind of free text a normalization rule applies to.
 */
public enum NormalizationTarget {
    ADDRESS,
    OWNER_NAME
}
