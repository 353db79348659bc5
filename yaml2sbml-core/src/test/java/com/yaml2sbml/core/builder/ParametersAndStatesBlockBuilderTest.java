package com.yaml2sbml.core.builder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.yaml2sbml.core.exception.DuplicateIdentifierException;
import com.yaml2sbml.core.exception.InvalidValueException;
import com.yaml2sbml.core.exception.SchemaException;
import com.yaml2sbml.core.model.Parameter;
import com.yaml2sbml.core.model.Species;
import com.yaml2sbml.core.registry.IdentifierKind;

/**
 * Tests for {@link ParametersBlockBuilder} and {@link StatesBlockBuilder}.
 */
class ParametersAndStatesBlockBuilderTest extends BlockBuilderTestBase {

    @Test
    void parameters_createsConstantParameters() {
        build(new ParametersBlockBuilder(), """
            parameters:
              - parameterId: alpha
                nominalValue: 1.1
              - id: beta
                value: "0.4"
            """);

        assertThat(context.entities()).containsExactly(
            new Parameter("alpha", "alpha", 1.1, true, "dimensionless"),
            new Parameter("beta", "beta", 0.4, true, "dimensionless"));
        assertThat(context.registry().find("beta")).contains(IdentifierKind.PARAMETER);
    }

    @Test
    void parameters_nonNumericValue_throws() {
        assertThatThrownBy(() -> build(new ParametersBlockBuilder(), """
            parameters:
              - parameterId: alpha
                nominalValue: fast
            """))
            .isInstanceOf(InvalidValueException.class)
            .hasMessageContaining("[parameters]")
            .hasMessageContaining("fast");
    }

    @Test
    void parameters_missingValue_throws() {
        assertThatThrownBy(() -> build(new ParametersBlockBuilder(), """
            parameters:
              - parameterId: alpha
            """))
            .isInstanceOf(SchemaException.class)
            .hasMessageContaining("nominalValue");
    }

    @Test
    void parameters_notAList_throws() {
        assertThatThrownBy(() -> build(new ParametersBlockBuilder(), """
            parameters:
              alpha: 1
            """))
            .isInstanceOf(SchemaException.class);
    }

    @Test
    void parameters_emptyBlock_addsNothing() {
        build(new ParametersBlockBuilder(), "parameters:\n");

        assertThat(context.entities()).isEmpty();
    }

    @Test
    void states_createSpeciesInCompartment() {
        build(new StatesBlockBuilder(), """
            states:
              - stateId: prey
                initialValue: 10
              - id: debt
                initial_value: -2.5
            """);

        assertThat(context.entities()).containsExactly(
            new Species("prey", "Compartment", 10, "dimensionless"),
            new Species("debt", "Compartment", -2.5, "dimensionless"));
        assertThat(context.registry().find("prey")).contains(IdentifierKind.STATE);
    }

    @Test
    void states_nameAlreadyUsedByParameter_throws() {
        build(new ParametersBlockBuilder(), """
            parameters:
              - parameterId: x
                nominalValue: 1
            """);

        assertThatThrownBy(() -> build(new StatesBlockBuilder(), """
            states:
              - stateId: x
                initialValue: 1
            """))
            .isInstanceOf(DuplicateIdentifierException.class)
            .hasMessageContaining("[states]");
    }
}
