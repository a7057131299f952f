package org.pak.backoff.core;

import lombok.EqualsAndHashCode;

/**
 * Key that partitions call sites for {@link BackoffOverrides}. The unnamed {@link #DEFAULT} namespace is shared by
 * every call site that does not pick one.
 */
@EqualsAndHashCode
public final class Namespace {
    public static final Namespace DEFAULT = new Namespace(null);

    private final String name;

    private Namespace(String name) {
        this.name = name;
    }

    public static Namespace of(String name) {
        if (name == null) {
            return DEFAULT;
        }

        if (name.isBlank()) {
            throw new IllegalArgumentException("Namespace name must not be blank");
        }

        return new Namespace(name);
    }

    /**
     * @return the name, or {@code null} for the default namespace
     */
    public String name() {
        return name;
    }

    public boolean isDefault() {
        return name == null;
    }

    @Override
    public String toString() {
        return isDefault() ? "<default>" : name;
    }
}
