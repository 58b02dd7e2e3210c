package FSM;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import FSM.Model.Symbol;

public class RandomAutomata {
    public static final List<Symbol<Integer>> BINARY = Symbol.listOf(0, 1);

    /**
     * Generate a random partial DFA, with the approach of Tabakov and Vardi adapted to determinism:
     * state 0 is initial and accepting, and each (state, symbol) pair gets a transition with
     * probability {@code td}.
     *
     * @param r
     *      random instance
     * @param size
     *      number of states
     * @param td
     *      transition density, in [0,1]
     * @param ad
     *      acceptance density, in [0,1]
     * @param alphabet
     *      alphabet
     * @return
     *      a random automaton, not necessarily connected
     */
    public static <I> Automaton<Integer, I> generate(Random r, int size, float td, float ad, List<Symbol<I>> alphabet) {
        final List<Integer> states = new ArrayList<>(size);
        final List<Integer> finals = new ArrayList<>();
        final Map<Integer, Map<Symbol<I>, Integer>> transitions = new HashMap<>();

        for (int i = 0; i < size; i++) {
            states.add(i);
            // per the paper, the first state is always accepting
            if (i == 0 || r.nextFloat() < ad) {
                finals.add(i);
            }
            final Map<Symbol<I>, Integer> row = new HashMap<>();
            for (Symbol<I> symbol : alphabet) {
                if (r.nextFloat() < td) {
                    row.put(symbol, r.nextInt(size));
                }
            }
            transitions.put(i, row);
        }
        return Automaton.build(alphabet, states, 0, finals, transitions);
    }

    public static Automaton<Integer, Integer> getRandomAutomaton(int randomSeed, int size) {
        final float td = 0.8f;
        final float ad = 0.3f;
        return generate(new Random(randomSeed), size, td, ad, BINARY);
    }

    /**
     * All strings over the alphabet values, up to the given length, shortest first.
     */
    public static <I> List<List<I>> allStrings(List<Symbol<I>> alphabet, int maxLength) {
        final List<List<I>> result = new ArrayList<>();
        result.add(List.of());
        int start = 0;
        for (int length = 1; length <= maxLength; length++) {
            final int end = result.size();
            for (int k = start; k < end; k++) {
                for (Symbol<I> symbol : alphabet) {
                    final List<I> s = new ArrayList<>(result.get(k));
                    s.add(symbol.getValue());
                    result.add(s);
                }
            }
            start = end;
        }
        return result;
    }
}
