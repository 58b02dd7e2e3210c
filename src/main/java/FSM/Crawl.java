package FSM;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Predicate;

import FSM.Model.SuperstateView;
import FSM.Model.Symbol;
import FSM.Registry.HashRegistry;
import FSM.Registry.Registry;

/**
 * Builds a finite automaton by discovering the superstates reachable through a successor function.
 * <p>
 * The caller must guarantee that only finitely many distinct superstates are reachable.
 * This is not checked: an unbounded successor function makes the crawl run until memory runs out.
 */
public class Crawl {
    public static boolean DEBUG = false;
    private static final long STATES_EXPLORED_PERIOD = 10000L;

    /**
     * Crawl with the default, hash-based registry.
     * @see #crawl(Collection, SuperstateView, Registry)
     */
    public static <T, I> Automaton<Integer, I> crawl(Collection<Symbol<I>> alphabet, SuperstateView<T, I> view) {
        return crawl(alphabet, view, new HashRegistry<>());
    }

    public static <T, I> Automaton<Integer, I> crawl(Collection<Symbol<I>> alphabet,
                                                     T initial,
                                                     Predicate<? super T> isFinal,
                                                     BiFunction<? super T, Symbol<I>, ? extends T> follow) {
        return crawl(alphabet, new SuperstateView<T, I>() {
            @Override
            public T getInitialState() {
                return initial;
            }

            @Override
            public boolean isAccepting(T superstate) {
                return isFinal.test(superstate);
            }

            @Override
            public T getSuccessor(T superstate, Symbol<I> symbol) {
                return follow.apply(superstate, symbol);
            }
        });
    }

    /**
     * Re-crawl an automaton through its own follow and finality. The result accepts the same
     * language, keeps only reachable states and numbers them 0..n-1 in discovery order.
     */
    public static <S, I> Automaton<Integer, I> crawl(Automaton<S, I> automaton) {
        return crawl(automaton.getAlphabet(), automaton.getInitialState(), automaton::hasFinal, automaton::follow);
    }

    /**
     * Breadth-first discovery loop.
     * @param alphabet - Symbols to follow from every superstate, in order
     * @param view - Initial superstate, finality and successor function
     * @param registry - Structural lookup of discovered superstates; must be empty
     * @throws FSM.Model.ConstructionException - if the alphabet contains null or a repeated symbol
     * @return - Automaton whose state i is the i-th discovered superstate; 0 is initial
     * @param <T> - Superstate type
     * @param <I> - Input value type
     */
    public static <T, I> Automaton<Integer, I> crawl(Collection<Symbol<I>> alphabet,
                                                     SuperstateView<T, I> view,
                                                     Registry<T> registry) {
        final List<Symbol<I>> symbols = Automaton.checkAlphabet(alphabet);
        final List<T> lookup = new ArrayList<>();
        final List<Map<Symbol<I>, Integer>> rows = new ArrayList<>();
        final Set<Integer> finals = new LinkedHashSet<>();

        final T init = view.getInitialState();
        lookup.add(init);
        registry.put(init, 0);

        int state = 0;
        while (state < lookup.size()) {
            final T curr = lookup.get(state);
            if (view.isAccepting(curr)) {
                finals.add(state);
            }

            final Map<Symbol<I>, Integer> row = new LinkedHashMap<>();
            for (Symbol<I> symbol : symbols) {
                final T succ = view.getSuccessor(curr, symbol);
                if (succ == null) {
                    continue; // oblivion: leave the transition out
                }
                int succID = registry.get(succ);
                if (succID == Registry.MISSING_ELEMENT) {
                    succID = lookup.size();
                    lookup.add(succ);
                    registry.put(succ, succID);
                }
                row.put(symbol, succID);
            }
            rows.add(row);
            state++;

            if (DEBUG && state % STATES_EXPLORED_PERIOD == 0) {
                System.out.println("DEBUG: Explored " + state + " superstates - "
                    + (lookup.size() - state) + " superstates left in queue");
            }
        }

        if (DEBUG) {
            System.out.println("DEBUG: Crawl (" + registry + ") finished: " + lookup.size()
                + " states, " + finals.size() + " final");
        }
        return Automaton.numbered(symbols, lookup.size(), finals, rows);
    }
}
