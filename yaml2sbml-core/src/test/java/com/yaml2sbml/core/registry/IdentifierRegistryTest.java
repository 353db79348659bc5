package com.yaml2sbml.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.yaml2sbml.core.exception.DuplicateIdentifierException;
import com.yaml2sbml.core.exception.SchemaException;
import com.yaml2sbml.core.exception.UnknownIdentifierException;

/**
 * Tests for {@link IdentifierRegistry}.
 */
class IdentifierRegistryTest {

    private final IdentifierRegistry registry = new IdentifierRegistry();

    @Test
    void declare_thenResolve() {
        registry.declare("parameters", "alpha", IdentifierKind.PARAMETER);
        registry.declare("states", "prey", IdentifierKind.STATE);

        assertThat(registry.resolve("alpha")).isEqualTo(IdentifierKind.PARAMETER);
        assertThat(registry.find("prey")).contains(IdentifierKind.STATE);
        assertThat(registry.entries()).containsKeys("alpha", "prey");
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void declare_sameNameInDifferentBlocks_throws() {
        registry.declare("parameters", "x", IdentifierKind.PARAMETER);

        assertThatThrownBy(() -> registry.declare("states", "x", IdentifierKind.STATE))
            .isInstanceOf(DuplicateIdentifierException.class)
            .hasMessageContaining("[states]")
            .hasMessageContaining("already declared as parameter");
    }

    @Test
    void declare_reservedConstant_throws() {
        assertThatThrownBy(() -> registry.declare("parameters", "pi", IdentifierKind.PARAMETER))
            .isInstanceOf(DuplicateIdentifierException.class)
            .hasMessageContaining("reserved");
    }

    @Test
    void declare_invalidIdentifier_throws() {
        assertThatThrownBy(() -> registry.declare("parameters", "2fast", IdentifierKind.PARAMETER))
            .isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> registry.declare("parameters", "d/dt", IdentifierKind.PARAMETER))
            .isInstanceOf(SchemaException.class);
    }

    @Test
    void declareFunction_recordsArity() {
        registry.declareFunction("functions", "hill", 4);

        assertThat(registry.isFunction("hill")).isTrue();
        assertThat(registry.arityOf("hill")).contains(4);
        assertThat(registry.arityOf("alpha")).isEmpty();
    }

    @Test
    void declareFunction_builtinName_throws() {
        assertThatThrownBy(() -> registry.declareFunction("functions", "exp", 1))
            .isInstanceOf(DuplicateIdentifierException.class)
            .hasMessageContaining("builtin");
    }

    @Test
    void resolve_unknownName_throws() {
        assertThatThrownBy(() -> registry.resolve("ghost"))
            .isInstanceOf(UnknownIdentifierException.class)
            .satisfies(e -> assertThat(((UnknownIdentifierException) e).getIdentifier()).isEqualTo("ghost"));
    }

    @Test
    void isValidIdentifier() {
        assertThat(IdentifierRegistry.isValidIdentifier("_x1")).isTrue();
        assertThat(IdentifierRegistry.isValidIdentifier("observable_Obs_1")).isTrue();
        assertThat(IdentifierRegistry.isValidIdentifier("")).isFalse();
        assertThat(IdentifierRegistry.isValidIdentifier("a-b")).isFalse();
        assertThat(IdentifierRegistry.isValidIdentifier(null)).isFalse();
    }
}
