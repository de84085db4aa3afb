package com.stashguard.validation;

/**
 * Machine-readable category of a validation failure.
 */
public enum FailureCode {

    // Payload shape
    MALFORMED_PAYLOAD,
    TOO_MANY_ITEMS,

    // Item rules
    MISSING_TEMPLATE_ID,
    INVALID_TEMPLATE_ID,
    UNKNOWN_TEMPLATE,
    INVALID_STACK,
    NOT_STACKABLE,
    INVALID_ROTATION,
    INVALID_CONDITION,
    NOT_A_CONTAINER,
    INVALID_CONTENTS,
    NESTING_TOO_DEEP,

    // Placement
    MISSING_POSITION,
    INVALID_POSITION,
    OUT_OF_BOUNDS,
    OVERLAP,

    // Equipment
    MISSING_SLOT,
    INVALID_SLOT,
    DUPLICATE_SLOT,
    NOT_EQUIPPABLE,
    WRONG_SLOT
}
