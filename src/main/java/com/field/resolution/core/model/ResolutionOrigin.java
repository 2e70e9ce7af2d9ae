package com.field.resolution.core.model;

/**
 * Where a final field value was decided.
 */
public enum ResolutionOrigin {
    LOCAL,
    EXTERNAL
}
