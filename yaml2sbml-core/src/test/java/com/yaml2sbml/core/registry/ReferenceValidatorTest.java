package com.yaml2sbml.core.registry;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.yaml2sbml.core.exception.ExpressionSyntaxException;
import com.yaml2sbml.core.exception.UnknownIdentifierException;
import com.yaml2sbml.core.expression.CompiledFormula;
import com.yaml2sbml.core.expression.ExpressionCompiler;

/**
 * Tests for {@link ReferenceValidator}.
 */
class ReferenceValidatorTest {

    private IdentifierRegistry registry;
    private ReferenceValidator validator;
    private ExpressionCompiler compiler;

    @BeforeEach
    void setUp() {
        registry = new IdentifierRegistry();
        validator = new ReferenceValidator(registry);
        compiler = new ExpressionCompiler(registry::isFunction);

        registry.declare("time", "t", IdentifierKind.TIME);
        registry.declare("parameters", "k", IdentifierKind.PARAMETER);
        registry.declare("states", "x", IdentifierKind.STATE);
        registry.declareFunction("functions", "sq", 1);
    }

    @Test
    void validate_declaredNamesAndReservedConstants_pass() {
        CompiledFormula formula = compiler.compile("k * x * sin(pi * t) + sq(x) + time");

        assertThatCode(() -> validator.validate("odes", formula)).doesNotThrowAnyException();
    }

    @Test
    void validate_undeclaredName_throws() {
        CompiledFormula formula = compiler.compile("k * y");

        assertThatThrownBy(() -> validator.validate("odes", formula))
            .isInstanceOf(UnknownIdentifierException.class)
            .hasMessageContaining("'y'")
            .hasMessageContaining("[odes]");
    }

    @Test
    void validate_functionUsedAsValue_throws() {
        CompiledFormula formula = compiler.compile("sq + 1");

        assertThatThrownBy(() -> validator.validate("odes", formula))
            .isInstanceOf(UnknownIdentifierException.class)
            .hasMessageContaining("is a function");
    }

    @Test
    void validate_userFunctionWithWrongArity_throws() {
        CompiledFormula formula = compiler.compile("sq(x, k)");

        assertThatThrownBy(() -> validator.validate("odes", formula))
            .isInstanceOf(ExpressionSyntaxException.class)
            .hasMessageContaining("expects 1");
    }

    @Test
    void validateClosed_argumentsOnly_passes() {
        CompiledFormula body = compiler.compile("a * b + pi", Set.of("a", "b"));

        assertThatCode(() -> validator.validateClosed("functions", "f", body)).doesNotThrowAnyException();
    }

    @Test
    void validateClosed_globalParameter_throws() {
        CompiledFormula body = compiler.compile("a * k", Set.of("a"));

        assertThatThrownBy(() -> validator.validateClosed("functions", "f", body))
            .isInstanceOf(UnknownIdentifierException.class)
            .hasMessageContaining("'k'");
    }

    @Test
    void validateClosed_time_throws() {
        CompiledFormula body = compiler.compile("a * time", Set.of("a"));

        assertThatThrownBy(() -> validator.validateClosed("functions", "f", body))
            .isInstanceOf(UnknownIdentifierException.class)
            .hasMessageContaining("time");
    }
}
