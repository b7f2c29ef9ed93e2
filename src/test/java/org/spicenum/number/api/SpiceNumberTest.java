package org.spicenum.number.api;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the value semantics of {@link SpiceNumber}: equality and ordering use only
 * the resolved value, the text rendering is the raw input.
 */
@Tag("unit")
class SpiceNumberTest {

    @Test
    void defaultIsZeroWrittenAsZero() {
        assertThat(SpiceNumber.DEFAULT.value()).isEqualTo(0.0);
        assertThat(SpiceNumber.DEFAULT.raw()).isEqualTo("0");
    }

    @Test
    void equalityIgnoresRaw() {
        SpiceNumber kilo = new SpiceNumber(1000.0, "1k");
        SpiceNumber plain = new SpiceNumber(1000.0, "1000");

        assertThat(kilo).isEqualTo(plain);
        assertThat(kilo.hashCode()).isEqualTo(plain.hashCode());
        assertThat(kilo.compareTo(plain)).isZero();
        assertThat(kilo).isNotEqualTo(new SpiceNumber(1001.0, "1k"));
    }

    @Test
    void negativeZeroEqualsZero() {
        SpiceNumber negativeZero = new SpiceNumber(-0.0, "-0");

        assertThat(negativeZero).isEqualTo(SpiceNumber.DEFAULT);
        assertThat(negativeZero.hashCode()).isEqualTo(SpiceNumber.DEFAULT.hashCode());
        assertThat(negativeZero.compareTo(SpiceNumber.DEFAULT)).isZero();
    }

    @Test
    void hashSetCollapsesEqualValues() {
        Set<SpiceNumber> set = new HashSet<>(List.of(
                new SpiceNumber(1e6, "1Meg"),
                new SpiceNumber(1e6, "1X"),
                new SpiceNumber(1e-3, "1m")));

        assertThat(set).hasSize(2);
    }

    @Test
    void orderingUsesValue() {
        List<SpiceNumber> numbers = new ArrayList<>(List.of(
                new SpiceNumber(1e6, "1Meg"),
                new SpiceNumber(-5.0, "-5"),
                new SpiceNumber(1e-3, "1m")));

        Collections.sort(numbers);

        assertThat(numbers).extracting(SpiceNumber::raw).containsExactly("-5", "1m", "1Meg");
    }

    @Test
    void toStringIsRawText() {
        assertThat(new SpiceNumber(123.0, "+123")).hasToString("+123");
    }

    @Test
    void rawIsRequired() {
        assertThatThrownBy(() -> new SpiceNumber(1.0, null)).isInstanceOf(NullPointerException.class);
    }
}
