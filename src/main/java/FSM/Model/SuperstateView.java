package FSM.Model;

/**
 * Construction-time view of an automaton whose states are composite "superstates".
 * Superstates must be immutable and compare structurally through equals/hashCode,
 * since equal configurations are rediscovered as freshly allocated values.
 * @param <T> - Superstate type
 * @param <I> - Input value type
 */
public interface SuperstateView<T, I> {

    T getInitialState();

    boolean isAccepting(T superstate);

    /**
     * @param superstate current superstate
     * @param symbol symbol to follow
     * @return successor superstate, or null for oblivion
     */
    T getSuccessor(T superstate, Symbol<I> symbol);
}
