package com.yaml2sbml.core.registry;

/**
 * What kind of entity a registered name refers to.
 */
public enum IdentifierKind {
    /** Constant parameter from the parameters block */
    PARAMETER,

    /** State variable (SBML species) */
    STATE,

    /** Target of an assignment rule from the assignments block */
    ASSIGNMENT,

    /** Function definition */
    FUNCTION,

    /** Observable parameter, registered under its prefixed output name */
    OBSERVABLE,

    /** The time variable */
    TIME,

    /** The model compartment, reserved before any block is built */
    COMPARTMENT;

    /**
     * Whether a formula may use a name of this kind as a value.
     *
     * @return false only for {@link #FUNCTION}
     */
    public boolean isValue() {
        return this != FUNCTION;
    }

    /**
     * Lower case label used in messages.
     *
     * @return e.g. "parameter", "state"
     */
    public String label() {
        return name().toLowerCase();
    }
}
