package FSM.Model;

/**
 * Thrown when an input symbol is outside an automaton's alphabet and the alphabet has no wildcard.
 */
public class UnrecognizedSymbolException extends RuntimeException {
    private final transient Symbol<?> symbol;

    public UnrecognizedSymbolException(Symbol<?> symbol) {
        super("Unrecognised symbol " + symbol);
        this.symbol = symbol;
    }

    public Symbol<?> getSymbol() {
        return symbol;
    }
}
