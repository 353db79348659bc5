package com.yaml2sbml.core.model;

import com.yaml2sbml.core.expression.CompiledFormula;

/**
 * A rule binding a variable to a formula.
 */
public interface ModelRule extends ModelEntity {

    String variable();

    CompiledFormula formula();

    @Override
    default String id() {
        return variable();
    }
}
