package FSM.Operators;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import FSM.Automaton;
import FSM.Model.SuperstateView;
import FSM.Model.Symbol;

/**
 * Concatenation of several automata ("machines"), tracking every machine we could currently be in.
 * Whenever a machine reaches a final state we may also be at the start of the next machine,
 * which {@link #connectAll} models as a chain of zero-width jumps.
 * @param <I> - Input value type
 */
public class Concatenation<I> implements SuperstateView<Set<Concatenation.Substate>, I> {
    private final List<Automaton<Object, I>> machines;

    public Concatenation(List<? extends Automaton<?, I>> machines) {
        if (machines.isEmpty()) {
            throw new IllegalArgumentException("Concatenation needs at least one automaton");
        }
        this.machines = Parallel.erase(machines);
    }

    public List<Symbol<I>> getAlphabet() {
        return Parallel.unifyAlphabets(machines);
    }

    /**
     * Take a state of machine {@code i} and return it together with (if it's final) the initial
     * state of the next machine, (if that's final) the initial state of the one after, and so on.
     */
    public Set<Substate> connectAll(int i, Object substate) {
        final Set<Substate> result = new LinkedHashSet<>();
        connectAll(i, substate, result);
        return Collections.unmodifiableSet(result);
    }

    private void connectAll(int i, Object substate, Set<Substate> into) {
        into.add(new Substate(i, substate));
        while (i < machines.size() - 1 && machines.get(i).hasFinal(substate)) {
            i++;
            substate = machines.get(i).getInitialState();
            into.add(new Substate(i, substate));
        }
    }

    @Override
    public Set<Substate> getInitialState() {
        return connectAll(0, machines.get(0).getInitialState());
    }

    @Override
    public boolean isAccepting(Set<Substate> superstate) {
        final int last = machines.size() - 1;
        for (Substate pair : superstate) {
            if (pair.machine() == last && machines.get(last).hasFinal(pair.state())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Set<Substate> getSuccessor(Set<Substate> superstate, Symbol<I> symbol) {
        final Set<Substate> next = new LinkedHashSet<>();
        for (Substate pair : superstate) {
            final Object succ = machines.get(pair.machine()).follow(pair.state(), symbol);
            if (succ != null) {
                connectAll(pair.machine(), succ, next);
            }
        }
        return next.isEmpty() ? null : Collections.unmodifiableSet(next);
    }

    /**
     * State of the machine at position {@code machine}.
     */
    public record Substate(int machine, Object state) { }
}
