package FSM;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import FSM.Model.Symbol;
import FSM.Operators.Concatenation;
import FSM.Operators.Parallel;
import FSM.Operators.Star;

/**
 * The automaton algebra. All operations leave their inputs untouched and return freshly crawled automata.
 */
public class Operations {

    /**
     * An automaton accepting nothing, not even the empty string.
     */
    public static <I> Automaton<Integer, I> nothing(Collection<Symbol<I>> alphabet) {
        final Map<Symbol<I>, Integer> loop = new LinkedHashMap<>();
        for (Symbol<I> symbol : alphabet) {
            loop.put(symbol, 0);
        }
        return Automaton.build(alphabet, List.of(0), 0, List.of(), Map.of(0, loop));
    }

    /**
     * An automaton accepting the empty string only.
     */
    public static <I> Automaton<Integer, I> epsilon(Collection<Symbol<I>> alphabet) {
        return Automaton.build(alphabet, List.of(0), 0, List.of(0), Map.of());
    }

    /**
     * Alternation: accepts any string accepted by at least one input. The alphabet is the union of the
     * inputs' alphabets; an input that cannot read a symbol simply rejects from there on.
     */
    public static <I> Automaton<Integer, I> union(List<? extends Automaton<?, I>> automata) {
        final Parallel<I> parallel = Parallel.union(automata);
        return Crawl.crawl(parallel.getAlphabet(), parallel);
    }

    @SafeVarargs
    public static <I> Automaton<Integer, I> union(Automaton<?, I>... automata) {
        return union(Arrays.asList(automata));
    }

    /**
     * Accepts the strings accepted by every input.
     */
    public static <I> Automaton<Integer, I> intersection(List<? extends Automaton<?, I>> automata) {
        final Parallel<I> parallel = Parallel.intersection(automata);
        return Crawl.crawl(parallel.getAlphabet(), parallel);
    }

    @SafeVarargs
    public static <I> Automaton<Integer, I> intersection(Automaton<?, I>... automata) {
        return intersection(Arrays.asList(automata));
    }

    /**
     * Accepts every string that splits into consecutive pieces accepted by the inputs, in order.
     * Concatenating no automata gives {@link #epsilon} over the empty alphabet.
     */
    public static <I> Automaton<Integer, I> concatenate(List<? extends Automaton<?, I>> automata) {
        if (automata.isEmpty()) {
            return epsilon(List.of());
        }
        final Concatenation<I> concatenation = new Concatenation<>(automata);
        return Crawl.crawl(concatenation.getAlphabet(), concatenation);
    }

    @SafeVarargs
    public static <I> Automaton<Integer, I> concatenate(Automaton<?, I>... automata) {
        return concatenate(Arrays.asList(automata));
    }

    /**
     * Concatenate {@code multiplier} copies of the automaton.
     * @throws IllegalArgumentException if {@code multiplier} is negative
     */
    public static <I> Automaton<Integer, I> multiply(Automaton<?, I> automaton, int multiplier) {
        if (multiplier < 0) {
            throw new IllegalArgumentException("Can't multiply an automaton by " + multiplier);
        }
        if (multiplier == 0) {
            return epsilon(automaton.getAlphabet());
        }
        return concatenate(Collections.nCopies(multiplier, automaton));
    }

    /**
     * Kleene closure: zero or more repetitions. Always accepts the empty string.
     */
    public static <I> Automaton<Integer, I> star(Automaton<?, I> automaton) {
        final Automaton<Integer, I> closure = Crawl.crawl(automaton.getAlphabet(), new Star<>(automaton));
        return union(List.of(epsilon(automaton.getAlphabet()), closure));
    }
}
