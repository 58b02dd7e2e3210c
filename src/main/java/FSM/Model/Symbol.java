package FSM.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A symbol of an automaton alphabet: either an ordinary input value or the "anything else" wildcard.
 * The wildcard is a single dedicated instance and never equals an ordinary symbol.
 * @param <I> - Input value type, e.g., Character
 */
public final class Symbol<I> {
    private static final Symbol<?> ANYTHING_ELSE = new Symbol<>(null);

    private final I value;

    private Symbol(I value) {
        this.value = value;
    }

    public static <I> Symbol<I> of(I value) {
        return new Symbol<>(Objects.requireNonNull(value, "symbol value"));
    }

    public static <I> Symbol<I> anythingElse() {
        return (Symbol<I>) ANYTHING_ELSE;
    }

    /**
     * Wrap each value, e.g. {@code Symbol.listOf('a', 'b')}.
     */
    @SafeVarargs
    public static <I> List<Symbol<I>> listOf(I... values) {
        final List<Symbol<I>> result = new ArrayList<>(values.length);
        for (I value : values) {
            result.add(of(value));
        }
        return Collections.unmodifiableList(result);
    }

    public boolean isAnythingElse() {
        return this == ANYTHING_ELSE;
    }

    /**
     * @return the wrapped input value
     * @throws IllegalStateException for the wildcard, which has no value
     */
    public I getValue() {
        if (isAnythingElse()) {
            throw new IllegalStateException("The anything-else symbol has no value");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Symbol<?> other) || isAnythingElse() || other.isAnythingElse()) {
            return false;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return isAnythingElse() ? 0 : value.hashCode();
    }

    @Override
    public String toString() {
        return isAnythingElse() ? "anything_else" : String.valueOf(value);
    }
}
