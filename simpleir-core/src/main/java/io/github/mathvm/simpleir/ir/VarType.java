package io.github.mathvm.simpleir.ir;

/**
 * The scalar types of variables and function results.
 */
public enum VarType {
    /**
     * Not known yet.
     */
    UNDEFINED,
    /**
     * No value, the return type of procedures.
     */
    UNIT,
    INT,
    DOUBLE,
    PTR,
    /**
     * The result of inference over conflicting types.
     */
    ERROR,
}
