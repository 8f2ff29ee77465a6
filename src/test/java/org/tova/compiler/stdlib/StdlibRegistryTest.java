package org.tova.compiler.stdlib;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the runtime fragment registry and its dependency ordering.
 */
public class StdlibRegistryTest {

    private static StdlibRegistry registry(String... lines) throws IOException {
        StdlibRegistry registry = new StdlibRegistry();
        StdlibRegistry.parse(new BufferedReader(new StringReader(String.join("\n", lines))), registry);
        return registry;
    }

    @Test
    @Tag("unit")
    void testFragmentsAreParsedFromHeaders() throws IOException {
        // Act
        StdlibRegistry registry = registry(
                "// preamble is ignored",
                "//# helper __twice",
                "function __twice(x) { return x * 2; }",
                "//# function quadruple deps=__twice",
                "function quadruple(x) { return __twice(__twice(x)); }",
                "//# class Result provides=Ok,Err",
                "function Ok(v) { return v; }");

        // Assert
        assertThat(registry.get("quadruple")).hasValueSatisfying(f -> {
            assertThat(f.kind()).isEqualTo(StdlibFragment.Kind.FUNCTION);
            assertThat(f.dependencies()).containsExactly("__twice");
            assertThat(f.code()).isEqualTo("function quadruple(x) { return __twice(__twice(x)); }");
        });
        assertThat(registry.isBuiltin("__twice")).isFalse();
        assertThat(registry.isBuiltin("quadruple")).isTrue();
        assertThat(registry.isBuiltin("Ok")).isTrue();
        assertThat(registry.builtinNames()).containsExactly("quadruple", "Ok", "Err");
    }

    @Test
    @Tag("unit")
    void testResolveOrdersDependenciesFirst() throws IOException {
        // Arrange
        StdlibRegistry registry = registry(
                "//# function outer deps=inner",
                "function outer() { return inner(); }",
                "//# function unused",
                "function unused() {}",
                "//# helper inner",
                "function inner() { return 1; }");

        // Act
        List<StdlibFragment> fragments = registry.resolve(List.of("outer", "not_a_builtin"));

        // Assert
        assertThat(fragments).extracting(StdlibFragment::name).containsExactly("inner", "outer");
        assertThat(registry.render(List.of())).isEmpty();
    }

    @Test
    @Tag("unit")
    void testDefaultRegistryCarriesCoreRuntime() {
        // Act
        StdlibRegistry registry = StdlibRegistry.defaultRegistry();

        // Assert
        assertThat(registry.isBuiltin("print")).isTrue();
        assertThat(registry.isBuiltin("__propagate")).isFalse();
        assertThat(registry.get("Some")).map(StdlibFragment::name).contains("Result");
        assertThat(registry.render(List.of("None"))).contains("const None = Object.freeze(");
        assertThat(StdlibRegistry.defaultRegistry()).isSameAs(registry);
    }
}
