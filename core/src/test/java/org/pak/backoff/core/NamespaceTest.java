package org.pak.backoff.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NamespaceTest {

    @Test
    void testNullIsDefault() {
        assertThat(Namespace.of(null)).isSameAs(Namespace.DEFAULT);
        assertThat(Namespace.DEFAULT.isDefault()).isTrue();
        assertThat(Namespace.DEFAULT.name()).isNull();
    }

    @Test
    void testEquality() {
        assertThat(Namespace.of("billing")).isEqualTo(Namespace.of("billing"));
        assertThat(Namespace.of("billing")).isNotEqualTo(Namespace.of("shipping"));
        assertThat(Namespace.of("billing")).isNotEqualTo(Namespace.DEFAULT);
    }

    @Test
    void testBlankName() {
        var exception = assertThrows(IllegalArgumentException.class, () -> Namespace.of("  "));

        assertThat(exception.getMessage()).isEqualTo("Namespace name must not be blank");
    }
}
