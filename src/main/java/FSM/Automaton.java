package FSM;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import FSM.Model.ConstructionException;
import FSM.Model.Symbol;
import FSM.Model.UnrecognizedSymbolException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Immutable deterministic finite automaton over an alphabet of {@link Symbol}s.
 * <p>
 * Transitions may be sparse. Any undeclared transition leads to oblivion, an implicit absorbing
 * non-final state that is never materialized: {@link #follow} returns {@code null} for it.
 * If the alphabet contains {@link Symbol#anythingElse()}, any symbol outside the alphabet is
 * read as that wildcard.
 *
 * @param <S> - State type; states of crawled automata are Integers 0..n-1
 * @param <I> - Input value type, e.g., Character
 */
public final class Automaton<S, I> {
    private final Alphabet<Symbol<I>> alphabet;
    private final Set<Symbol<I>> symbols;
    private final boolean anythingElse;
    private final Set<S> states;
    private final S initial;
    private final Set<S> finals;
    private final Map<S, Map<Symbol<I>, S>> transitions;

    // computed on first use
    private Set<S> liveStates;

    private Automaton(List<Symbol<I>> alphabet, Set<S> states, S initial, Set<S> finals,
                      Map<S, Map<Symbol<I>, S>> transitions) {
        this.alphabet = Alphabets.fromCollection(alphabet);
        this.symbols = new HashSet<>(alphabet);
        this.anythingElse = symbols.contains(Symbol.anythingElse());
        this.states = Collections.unmodifiableSet(states);
        this.initial = initial;
        this.finals = Collections.unmodifiableSet(finals);
        this.transitions = Collections.unmodifiableMap(transitions);
    }

    /**
     * Build a literal automaton. States keep the identities given here.
     * @param alphabet - symbols, in enumeration order; no duplicates
     * @param states - all states; none may be null
     * @param initial - initial state, one of {@code states}
     * @param finals - accepting states, all in {@code states}
     * @param transitions - sparse transition table; sources, symbols and targets must be declared
     * @return the automaton
     * @throws ConstructionException if any of the above does not hold
     */
    public static <S, I> Automaton<S, I> build(Collection<Symbol<I>> alphabet,
                                               Collection<S> states,
                                               S initial,
                                               Collection<S> finals,
                                               Map<S, ? extends Map<Symbol<I>, S>> transitions) {
        final List<Symbol<I>> symbolList = checkAlphabet(alphabet);
        final Set<Symbol<I>> seen = new HashSet<>(symbolList);

        final Set<S> stateSet = new LinkedHashSet<>();
        for (S state : states) {
            if (state == null) {
                throw new ConstructionException("States must not be null");
            }
            stateSet.add(state);
        }

        if (!stateSet.contains(initial)) {
            throw new ConstructionException("Initial state " + initial + " must be one of " + stateSet);
        }

        final Set<S> finalSet = new LinkedHashSet<>();
        for (S fin : finals) {
            if (!stateSet.contains(fin)) {
                throw new ConstructionException("Final state " + fin + " must be one of " + stateSet);
            }
            finalSet.add(fin);
        }

        final Map<S, Map<Symbol<I>, S>> table = new LinkedHashMap<>();
        for (Map.Entry<S, ? extends Map<Symbol<I>, S>> row : transitions.entrySet()) {
            final S state = row.getKey();
            if (!stateSet.contains(state)) {
                throw new ConstructionException("Transitions given for " + state + ", which is not a state");
            }
            final Map<Symbol<I>, S> copy = new LinkedHashMap<>();
            for (Map.Entry<Symbol<I>, S> t : row.getValue().entrySet()) {
                if (!seen.contains(t.getKey())) {
                    throw new ConstructionException("Transition for state " + state + " uses symbol "
                        + t.getKey() + ", which is not in the alphabet");
                }
                if (!stateSet.contains(t.getValue())) {
                    throw new ConstructionException("Transition for state " + state + " and symbol "
                        + t.getKey() + " leads to " + t.getValue() + ", which is not a state");
                }
                copy.put(t.getKey(), t.getValue());
            }
            table.put(state, Collections.unmodifiableMap(copy));
        }

        return new Automaton<>(symbolList, stateSet, initial, finalSet, table);
    }

    /**
     * @return the symbols in order
     * @throws ConstructionException on a null or repeated symbol
     */
    static <I> List<Symbol<I>> checkAlphabet(Collection<Symbol<I>> alphabet) {
        final List<Symbol<I>> symbolList = new ArrayList<>(alphabet.size());
        final Set<Symbol<I>> seen = new HashSet<>();
        for (Symbol<I> symbol : alphabet) {
            if (symbol == null) {
                throw new ConstructionException("Alphabet contains null");
            }
            if (!seen.add(symbol)) {
                throw new ConstructionException("Duplicate alphabet symbol " + symbol);
            }
            symbolList.add(symbol);
        }
        return symbolList;
    }

    /**
     * Assemble a crawled automaton with states 0..n-1. The caller guarantees consistency.
     */
    static <I> Automaton<Integer, I> numbered(Collection<Symbol<I>> alphabet, int size, Set<Integer> finals,
                                              List<Map<Symbol<I>, Integer>> rows) {
        final Set<Integer> stateSet = new LinkedHashSet<>();
        final Map<Integer, Map<Symbol<I>, Integer>> table = new LinkedHashMap<>();
        for (int i = 0; i < size; i++) {
            stateSet.add(i);
            table.put(i, Collections.unmodifiableMap(rows.get(i)));
        }
        return new Automaton<>(new ArrayList<>(alphabet), stateSet, 0, new LinkedHashSet<>(finals), table);
    }

    public Alphabet<Symbol<I>> getAlphabet() {
        return alphabet;
    }

    public boolean hasAnythingElse() {
        return anythingElse;
    }

    public Set<S> getStates() {
        return states;
    }

    public S getInitialState() {
        return initial;
    }

    public Set<S> getFinalStates() {
        return finals;
    }

    /**
     * @return the sparse transition table; absent entries lead to oblivion
     */
    public Map<S, Map<Symbol<I>, S>> getTransitions() {
        return transitions;
    }

    public int size() {
        return states.size();
    }

    /**
     * Whether the symbol can be consumed, either verbatim or through the wildcard.
     */
    public boolean canRead(Symbol<I> symbol) {
        return symbols.contains(symbol) || (anythingElse && !symbol.isAnythingElse());
    }

    /**
     * Follow a single transition. Never throws for unknown symbols; these simply lead to oblivion.
     * @param state - current state, or null for oblivion
     * @param symbol - symbol to consume
     * @return successor state, or null for oblivion
     */
    public S follow(S state, Symbol<I> symbol) {
        if (state == null) {
            return null; // oblivion is absorbing
        }
        Symbol<I> resolved = symbol;
        if (!symbols.contains(resolved)) {
            if (!anythingElse || resolved.isAnythingElse()) {
                return null;
            }
            resolved = Symbol.anythingElse();
        }
        final Map<Symbol<I>, S> row = transitions.get(state);
        return row == null ? null : row.get(resolved);
    }

    /**
     * {@link #follow(Object, Symbol)} for a plain input value.
     */
    public S follow(S state, I value) {
        return follow(state, Symbol.of(value));
    }

    public boolean hasFinal(S state) {
        return state != null && finals.contains(state);
    }

    /**
     * Test whether this automaton accepts the input sequence.
     * @throws UnrecognizedSymbolException for the first value outside the alphabet, if there is no wildcard
     */
    public boolean accepts(Iterable<? extends I> input) {
        S state = initial;
        for (I value : input) {
            state = consume(state, Symbol.of(value));
        }
        return hasFinal(state);
    }

    /**
     * Like {@link #accepts}, for sequences that are already symbols, e.g. ones produced by {@link #strings()}.
     */
    public boolean acceptsSymbols(Iterable<Symbol<I>> input) {
        S state = initial;
        for (Symbol<I> symbol : input) {
            state = consume(state, Objects.requireNonNull(symbol));
        }
        return hasFinal(state);
    }

    private S consume(S state, Symbol<I> symbol) {
        // checked even once we are in oblivion
        if (!canRead(symbol)) {
            throw new UnrecognizedSymbolException(symbol);
        }
        return follow(state, symbol);
    }

    /**
     * @return states from which some final state can be reached
     */
    public Set<S> getLiveStates() {
        if (liveStates == null) {
            liveStates = Collections.unmodifiableSet(Liveness.liveStates(this));
        }
        return liveStates;
    }

    public boolean isLive(S state) {
        return state != null && getLiveStates().contains(state);
    }

    /**
     * @return true iff this automaton accepts no string at all
     */
    public boolean isEmpty() {
        return !isLive(initial);
    }

    /**
     * Lazily enumerate accepted strings, shortest first and then in alphabet order.
     * Each call returns a new, single-pass enumerator.
     */
    public StringEnumerator<S, I> strings() {
        return new StringEnumerator<>(this);
    }

    @Override
    public String toString() {
        return "Automaton[alphabet=" + alphabet + ", states=" + states.size()
            + ", initial=" + initial + ", finals=" + finals + "]";
    }
}
