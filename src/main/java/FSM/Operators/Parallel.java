package FSM.Operators;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import FSM.Automaton;
import FSM.Model.SuperstateView;
import FSM.Model.Symbol;

/**
 * Product construction over several automata run side by side.
 * A superstate lists, for every automaton still alive, its index and current state.
 * An automaton that cannot read a symbol (not in its alphabet, no wildcard) drops out of the
 * superstate, just as if it had fallen into oblivion; this lets automata with different
 * alphabets be combined.
 * @param <I> - Input value type
 */
public class Parallel<I> implements SuperstateView<List<Parallel.Substate>, I> {
    private final List<Automaton<Object, I>> automata;
    private final Predicate<List<Substate>> isFinal;

    private Parallel(List<Automaton<Object, I>> automata, Predicate<List<Substate>> isFinal) {
        this.automata = automata;
        this.isFinal = isFinal;
    }

    /**
     * Accepting when any automaton is in one of its final states.
     */
    public static <I> Parallel<I> union(List<? extends Automaton<?, I>> automata) {
        final List<Automaton<Object, I>> machines = erase(automata);
        return new Parallel<>(machines,
            state -> state.stream().anyMatch(p -> machines.get(p.index()).hasFinal(p.state())));
    }

    /**
     * Accepting when every automaton is present and in one of its final states.
     * An automaton that has dropped out can never satisfy this.
     */
    public static <I> Parallel<I> intersection(List<? extends Automaton<?, I>> automata) {
        final List<Automaton<Object, I>> machines = erase(automata);
        return new Parallel<>(machines,
            state -> state.size() == machines.size()
                && state.stream().allMatch(p -> machines.get(p.index()).hasFinal(p.state())));
    }

    /**
     * Union of alphabets, keeping first-seen order.
     */
    public static <I> List<Symbol<I>> unifyAlphabets(Collection<? extends Automaton<?, I>> automata) {
        final Set<Symbol<I>> unified = new LinkedHashSet<>();
        for (Automaton<?, I> automaton : automata) {
            unified.addAll(automaton.getAlphabet());
        }
        return new ArrayList<>(unified);
    }

    public List<Symbol<I>> getAlphabet() {
        return unifyAlphabets(automata);
    }

    @Override
    public List<Substate> getInitialState() {
        final List<Substate> initial = new ArrayList<>(automata.size());
        for (int i = 0; i < automata.size(); i++) {
            initial.add(new Substate(i, automata.get(i).getInitialState()));
        }
        return List.copyOf(initial);
    }

    @Override
    public boolean isAccepting(List<Substate> superstate) {
        return isFinal.test(superstate);
    }

    @Override
    public List<Substate> getSuccessor(List<Substate> superstate, Symbol<I> symbol) {
        final List<Substate> next = new ArrayList<>(superstate.size());
        for (Substate pair : superstate) {
            final Object succ = automata.get(pair.index()).follow(pair.state(), symbol);
            if (succ != null) {
                next.add(new Substate(pair.index(), succ));
            }
        }
        return next.isEmpty() ? null : List.copyOf(next);
    }

    static <I> List<Automaton<Object, I>> erase(List<? extends Automaton<?, I>> automata) {
        return List.copyOf((List<Automaton<Object, I>>) (List<?>) automata);
    }

    /**
     * State of the automaton at position {@code index} of the input list.
     */
    public record Substate(int index, Object state) { }
}
