package FSM.Registry;

/**
 * Maps discovered superstates to their state IDs during a crawl.
 * Lookups are structural: a freshly built superstate equal to a registered one resolves to the same ID.
 * @param <T> - Superstate type
 */
public interface Registry<T> {
    int MISSING_ELEMENT = -1;

    /**
     * Get state ID of a superstate.
     * @param superstate superstate to look up
     * @return state ID or MISSING_ELEMENT if the superstate was not registered.
     */
    int get(T superstate);

    /**
     * Register a new superstate with its (fixed) state ID.
     * @param superstate superstate
     * @param stateID state ID
     */
    void put(T superstate, int stateID);

    /**
     * @return number of registered superstates
     */
    int size();
}
