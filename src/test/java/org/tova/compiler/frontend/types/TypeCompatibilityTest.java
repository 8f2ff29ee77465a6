package org.tova.compiler.frontend.types;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the assignability rules of the gradual type model.
 */
public class TypeCompatibilityTest {

    private static final Type INT = PrimitiveType.INT;
    private static final Type FLOAT = PrimitiveType.FLOAT;
    private static final Type STRING = PrimitiveType.STRING;

    @Test
    @Tag("unit")
    void testUnknownAndAnyAreCompatibleBothWays() {
        assertThat(UnknownType.INSTANCE.isAssignableTo(INT)).isTrue();
        assertThat(STRING.isAssignableTo(UnknownType.INSTANCE)).isTrue();
        assertThat(AnyType.INSTANCE.isAssignableTo(FLOAT)).isTrue();
        assertThat(INT.isAssignableTo(AnyType.INSTANCE)).isTrue();
    }

    @Test
    @Tag("unit")
    void testIntWidensToFloatButNotBack() {
        assertThat(INT.isAssignableTo(FLOAT)).isTrue();
        assertThat(FLOAT.isAssignableTo(INT)).isFalse();
        assertThat(STRING.isAssignableTo(INT)).isFalse();
    }

    @Test
    @Tag("unit")
    void testNilFlowsOnlyIntoOptionalSlots() {
        // Arrange
        Type optionalInt = new UnionType(List.of(INT, NilType.INSTANCE));
        Type option = new GenericType("Option", List.of(INT));

        // Act / Assert
        assertThat(NilType.INSTANCE.isAssignableTo(optionalInt)).isTrue();
        assertThat(NilType.INSTANCE.isAssignableTo(option)).isTrue();
        assertThat(NilType.INSTANCE.isAssignableTo(INT)).isFalse();
        assertThat(INT.isAssignableTo(optionalInt)).isTrue();
        assertThat(optionalInt.display()).isEqualTo("Int?");
    }

    @Test
    @Tag("unit")
    void testArraysAreCovariantInTheirElement() {
        assertThat(new ArrayType(INT).isAssignableTo(new ArrayType(FLOAT))).isTrue();
        assertThat(new ArrayType(STRING).isAssignableTo(new ArrayType(INT))).isFalse();
    }

    @Test
    @Tag("unit")
    void testFunctionParametersAreContravariant() {
        // Arrange
        Type takesFloat = new FunctionType(List.of(FLOAT), INT);
        Type takesInt = new FunctionType(List.of(INT), INT);

        // Act / Assert
        assertThat(takesFloat.isAssignableTo(takesInt)).isTrue();
        assertThat(takesInt.isAssignableTo(takesFloat)).isFalse();
    }

    @Test
    @Tag("unit")
    void testGenericsMatchByNameAndArguments() {
        // Arrange
        Type okInt = new GenericType("Result", List.of(INT, STRING));
        Type okString = new GenericType("Result", List.of(STRING, STRING));
        Type bare = new GenericType("Result", List.of());

        // Act / Assert
        assertThat(okInt.isAssignableTo(bare)).isTrue();
        assertThat(okInt.isAssignableTo(okString)).isFalse();
        assertThat(okInt.display()).isEqualTo("Result<Int, String>");
    }

    @Test
    @Tag("unit")
    void testUnionSourceNeedsEveryMemberAssignable() {
        // Arrange
        Type intOrString = new UnionType(List.of(INT, STRING));

        // Act / Assert
        assertThat(intOrString.isAssignableTo(INT)).isFalse();
        assertThat(intOrString.isAssignableTo(new UnionType(List.of(STRING, FLOAT)))).isTrue();
    }
}
