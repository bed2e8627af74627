package com.darboux.integration;

import com.darboux.exception.ValidationException;
import com.darboux.test.TestBase;
import com.darboux.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link IntervalParser} and {@link Interval}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("IntervalParser Tests")
public class IntervalParserTest extends TestBase {

    @Test
    @DisplayName("Canonical interval parses")
    void testCanonical() {
        Interval interval = IntervalParser.parse("[0 ; 2]");

        assertThat(interval.start()).isEqualTo(0.0);
        assertThat(interval.end()).isEqualTo(2.0);
        assertThat(interval.isReversed()).isFalse();
    }

    @Test
    @DisplayName("Whitespace around bounds is optional")
    void testCompact() {
        assertThat(IntervalParser.parse("[-1.5;3e1]")).isEqualTo(new Interval(-1.5, 30.0));
        assertThat(IntervalParser.parse("  [ .5 ;   -2 ]  ")).isEqualTo(new Interval(0.5, -2.0));
    }

    @Test
    @DisplayName("Descending bounds are kept in entered order")
    void testReversed() {
        Interval interval = IntervalParser.parse("[2 ; 0]");

        assertThat(interval.isReversed()).isTrue();
        assertThat(interval.normalized()).isEqualTo(new Interval(0.0, 2.0));
        assertThat(interval.width()).isEqualTo(2.0);
    }

    @ParameterizedTest
    @ValueSource(strings = {"[ ; ]", "[;]", "", "   "})
    @DisplayName("Missing bounds mean the interval is not defined")
    void testUndefined(String text) {
        assertThatThrownBy(() -> IntervalParser.parse(text))
            .isInstanceOf(ValidationException.class)
            .hasMessage("The interval is not defined");
    }

    @Test
    @DisplayName("Null text means the interval is not defined")
    void testNull() {
        assertThatThrownBy(() -> IntervalParser.parse(null))
            .isInstanceOf(ValidationException.class)
            .hasMessage("The interval is not defined");
    }

    @ParameterizedTest
    @ValueSource(strings = {"[1 ; ]", "[ ; 2]", "0 ; 2", "[0, 2]", "[0,5 ; 2]", "[a ; b]", "[0 ; 2", "[0 ; 1 ; 2]"})
    @DisplayName("Malformed intervals are rejected")
    void testMalformed(String text) {
        ValidationException e = catchThrowableOfType(() -> IntervalParser.parse(text), ValidationException.class);

        assertThat(e.getMessage()).startsWith("Malformed interval");
        assertThat(e.getPhase()).isEqualTo("interval validation");
    }

    @Test
    @DisplayName("Degenerate interval is rejected")
    void testDegenerate() {
        assertThatThrownBy(() -> IntervalParser.parse("[2 ; 2]"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Integrating over a [c ; c] interval is defined to be equal to 0");
        assertThatThrownBy(() -> IntervalParser.parse("[2 ; 2.0]"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Bounds overflowing the double range are rejected")
    void testInfiniteBounds() {
        assertThatThrownBy(() -> IntervalParser.parse("[0 ; 1e999]"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Interval bounds must be finite");
    }

    @Test
    @DisplayName("Format produces the stored history line")
    void testFormat() {
        assertThat(IntervalParser.format(" 0 ", "2.5")).isEqualTo("[0 ; 2.5]");
        assertThat(IntervalParser.parse(IntervalParser.format("1", "3"))).isEqualTo(new Interval(1, 3));
    }

    @Test
    @DisplayName("Subinterval width divides the absolute width")
    void testSubintervalWidth() {
        assertThat(new Interval(2, 0).subintervalWidth(4)).isEqualTo(0.5);
        assertThatThrownBy(() -> new Interval(0, 1).subintervalWidth(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
