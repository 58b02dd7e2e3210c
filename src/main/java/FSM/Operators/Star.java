package FSM.Operators;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import FSM.Automaton;
import FSM.Model.SuperstateView;
import FSM.Model.Symbol;

/**
 * Kleene closure of one automaton. A superstate is the set of states of that automaton we could be in.
 * <p>
 * Wiring the final states back to the initial state is not enough: for {@code (b*ab)*} that would
 * confuse "about to restart" with "already restarted". Instead, from a final state we also follow
 * the symbol out of the initial state, as a separate candidate.
 * The closure does not by itself accept the empty string; see {@code Operations.star}.
 * @param <I> - Input value type
 */
public class Star<I> implements SuperstateView<Set<Object>, I> {
    private final Automaton<Object, I> automaton;

    public Star(Automaton<?, I> automaton) {
        this.automaton = (Automaton<Object, I>) automaton;
    }

    @Override
    public Set<Object> getInitialState() {
        return Collections.singleton(automaton.getInitialState());
    }

    @Override
    public boolean isAccepting(Set<Object> superstate) {
        for (Object substate : superstate) {
            if (automaton.hasFinal(substate)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Set<Object> getSuccessor(Set<Object> superstate, Symbol<I> symbol) {
        final Set<Object> next = new LinkedHashSet<>();
        for (Object substate : superstate) {
            final Object succ = automaton.follow(substate, symbol);
            if (succ != null) {
                next.add(succ);
            }
            // re-entry: a final substate may also start a new iteration
            if (automaton.hasFinal(substate)) {
                final Object restart = automaton.follow(automaton.getInitialState(), symbol);
                if (restart != null) {
                    next.add(restart);
                }
            }
        }
        return next.isEmpty() ? null : Collections.unmodifiableSet(next);
    }
}
