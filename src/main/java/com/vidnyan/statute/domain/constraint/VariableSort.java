package com.vidnyan.statute.domain.constraint;

/**
 * Sort of a constraint variable.
 */
public enum VariableSort {
    INT,
    BOOL,
    STRING
}
