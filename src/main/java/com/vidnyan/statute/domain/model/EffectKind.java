package com.vidnyan.statute.domain.model;

/**
 * Kind of legal consequence a statute produces.
 */
public enum EffectKind {
    GRANT,        // confers a right or permission
    REVOKE,       // withdraws a right or permission
    OBLIGATION,   // imposes a duty
    PROHIBITION,  // forbids an action
    DISCRETION    // defers the consequence to a human decision
}
