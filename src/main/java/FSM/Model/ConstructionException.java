package FSM.Model;

/**
 * Thrown when a literal automaton violates a structural invariant. No automaton is produced.
 */
public class ConstructionException extends RuntimeException {
    public ConstructionException(String message) {
        super(message);
    }
}
