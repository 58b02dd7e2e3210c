package FSM;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import FSM.Model.Symbol;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.common.util.HashUtil;

/**
 * Conversions between {@link Automaton} and AutomataLib DFAs.
 */
public class DFAConversion {

    /**
     * Copy into a complete AutomataLib DFA over the same symbols, so that AutomataLib algorithms
     * (minimization, equivalence testing, serialization) can be applied.
     * Oblivion becomes an explicit rejecting sink, added only if some transition is undefined.
     * The initial state is 0; other states keep the automaton's state order.
     */
    public static <S, I> CompactDFA<Symbol<I>> toCompactDFA(Automaton<S, I> automaton) {
        final Alphabet<Symbol<I>> alphabet = automaton.getAlphabet();
        final CompactDFA<Symbol<I>> out = new CompactDFA<>(alphabet, automaton.size());
        final Map<S, Integer> outStateMap = new HashMap<>(HashUtil.capacity(automaton.size()));

        final S init = automaton.getInitialState();
        outStateMap.put(init, out.addInitialState(automaton.hasFinal(init)));
        for (S state : automaton.getStates()) {
            if (!outStateMap.containsKey(state)) {
                outStateMap.put(state, out.addState(automaton.hasFinal(state)));
            }
        }

        int sink = -1;
        for (S state : automaton.getStates()) {
            final int outState = outStateMap.get(state);
            for (Symbol<I> symbol : alphabet) {
                final S succ = automaton.follow(state, symbol);
                final int outSucc;
                if (succ != null) {
                    outSucc = outStateMap.get(succ);
                } else {
                    if (sink < 0) {
                        sink = out.addState(false);
                        for (Symbol<I> s : alphabet) {
                            out.setTransition(sink, alphabet.getSymbolIndex(s), sink);
                        }
                    }
                    outSucc = sink;
                }
                out.setTransition(outState, alphabet.getSymbolIndex(symbol), outSucc);
            }
        }
        return out;
    }

    /**
     * Import an AutomataLib DFA by crawling its reachable part. Undefined transitions become oblivion.
     * A DFA without an initial state accepts nothing.
     */
    public static <S, I> Automaton<Integer, I> fromDFA(DFA<S, I> dfa, Alphabet<I> inputs) {
        final List<Symbol<I>> alphabet = new ArrayList<>(inputs.size());
        for (I input : inputs) {
            alphabet.add(Symbol.of(input));
        }

        final S init = dfa.getInitialState();
        if (init == null) {
            return Operations.nothing(alphabet);
        }
        return Crawl.crawl(alphabet, init, state -> dfa.isAccepting(state),
            (state, symbol) -> symbol.isAnythingElse() ? null : dfa.getSuccessor(state, symbol.getValue()));
    }
}
