package org.metadump.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SourceVersionTest {

    @Test
    void comparesDottedComponentsNumerically() {
        SourceVersion version = new SourceVersion("4.3.99");

        assertThat(version.before("5")).isTrue();
        assertThat(version.before("4.3.100")).isTrue();
        assertThat(version.atLeast("4.3")).isTrue();
        assertThat(new SourceVersion("10.0").compareTo(new SourceVersion("9.9.9"))).isPositive();
    }

    @Test
    void missingComponentsCountAsZero() {
        assertThat(new SourceVersion("5").compareTo(new SourceVersion("5.0.0"))).isZero();
        assertThat(new SourceVersion("5").atLeast("5.0")).isTrue();
    }

    @Test
    void rejectsMalformedVersions() {
        assertThatThrownBy(() -> new SourceVersion("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SourceVersion("5.x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SourceVersion("5..1")).isInstanceOf(IllegalArgumentException.class);
    }
}
