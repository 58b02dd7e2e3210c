package FSM;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import FSM.Model.Symbol;
import net.automatalib.common.util.HashUtil;

public class Liveness {

    /**
     * Co-accessible states: those from which some final state is reachable.
     * Walks the reversed transition relation from every final state with an explicit worklist,
     * so deep automata cannot exhaust the call stack.
     * @param automaton - automaton to analyse
     * @return live states (a fresh, mutable set)
     * @param <S> - State type
     * @param <I> - Input value type
     */
    public static <S, I> Set<S> liveStates(Automaton<S, I> automaton) {
        final Map<S, List<S>> predecessors = reverse(automaton);
        final Set<S> live = new HashSet<>(HashUtil.capacity(automaton.size()));
        final Deque<S> worklist = new ArrayDeque<>();

        for (S fin : automaton.getFinalStates()) {
            if (live.add(fin)) {
                worklist.push(fin);
            }
        }

        while (!worklist.isEmpty()) {
            final S curr = worklist.pop();
            for (S pred : predecessors.getOrDefault(curr, List.of())) {
                if (live.add(pred)) {
                    worklist.push(pred);
                }
            }
        }
        return live;
    }

    private static <S, I> Map<S, List<S>> reverse(Automaton<S, I> automaton) {
        final Map<S, List<S>> result = new HashMap<>(HashUtil.capacity(automaton.size()));
        for (Map.Entry<S, Map<Symbol<I>, S>> row : automaton.getTransitions().entrySet()) {
            final S source = row.getKey();
            for (S target : row.getValue().values()) {
                result.computeIfAbsent(target, k -> new ArrayList<>()).add(source);
            }
        }
        return result;
    }
}
