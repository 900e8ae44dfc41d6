package com.nayem.tenancy.saga;

import java.util.Objects;

/**
 * Typed name of a fact stored in a {@link SagaContext}.
 *
 * @param <V> The value type
 */
public final class ContextKey<V> {

    private final String name;
    private final Class<V> type;

    private ContextKey(String name, Class<V> type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static <V> ContextKey<V> of(String name, Class<V> type) {
        return new ContextKey<>(name, type);
    }

    public String name() {
        return name;
    }

    V cast(Object value) {
        return type.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContextKey<?> other)) {
            return false;
        }
        return name.equals(other.name) && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name;
    }
}
