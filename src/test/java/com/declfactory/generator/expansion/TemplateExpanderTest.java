package com.declfactory.generator.expansion;

import com.declfactory.generator.expansion.exception.ExpansionException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TemplateExpanderTest {

    private final TemplateExpander expander = new TemplateExpander();

    @Test
    void testExpandSourceReturnsPrintedUnit() {
        String expanded = expander.expandSource("""
            class Limits {
                @Template(T = {Byte, Short})
                static final long MAX_T = T.MAX_VALUE;
            }
            """);

        assertThat(expanded)
                .contains("static final long MAX_T = Byte.MAX_VALUE;")
                .contains("static final long MAX_T = Short.MAX_VALUE;")
                .doesNotContain("@Template");
    }

    @Test
    void testUnparsableSourceIsFatal() {
        assertThatThrownBy(() -> expander.expandSource("class { }"))
                .isInstanceOf(ExpansionException.class)
                .hasMessageStartingWith("Source does not parse");
    }

    @Test
    void testFailureCarriesLocation() {
        ExpansionException failure = catchThrowableOfType(() -> expander.expandSource("""
            class Located {

                @Template(v = nowhere)
                int f() { return v; }
            }
            """), ExpansionException.class);

        assertThat(failure.getLocation()).startsWith("line 3: @Template(v = nowhere)");
    }
}
