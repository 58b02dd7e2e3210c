package FSM;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import FSM.Model.Symbol;

/**
 * Single-pass generator of the strings an automaton accepts, in shortlex order
 * (by length, then by alphabet order).
 * <p>
 * The frontier is an append-only list of (prefix, reached state) pairs, read through a cursor.
 * Only successors in live states are appended, so a finite language exhausts the frontier and
 * {@link #hasNext()} eventually returns false. For an infinite language the enumerator never ends
 * and the frontier grows without bound; callers stop by not asking for more.
 *
 * @param <S> - State type
 * @param <I> - Input value type
 */
public class StringEnumerator<S, I> implements Iterator<List<Symbol<I>>> {
    private final Automaton<S, I> automaton;
    private final List<FrontierRecord<S, I>> frontier;
    private int cursor;

    private List<Symbol<I>> pending;
    private boolean exhausted;

    StringEnumerator(Automaton<S, I> automaton) {
        this.automaton = automaton;
        this.frontier = new ArrayList<>();
        this.frontier.add(new FrontierRecord<>(List.of(), automaton.getInitialState()));
        this.cursor = -1;
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !exhausted) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public List<Symbol<I>> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final List<Symbol<I>> result = pending;
        pending = null;
        return result;
    }

    /**
     * Collect up to {@code limit} further strings.
     */
    public List<List<Symbol<I>>> take(int limit) {
        final List<List<Symbol<I>>> result = new ArrayList<>();
        while (result.size() < limit && hasNext()) {
            result.add(next());
        }
        return result;
    }

    private List<Symbol<I>> advance() {
        while (true) {
            cursor++;
            if (cursor >= frontier.size()) {
                exhausted = true;
                return null;
            }
            final FrontierRecord<S, I> curr = frontier.get(cursor);

            for (Symbol<I> symbol : automaton.getAlphabet()) {
                final S succ = automaton.follow(curr.state(), symbol);
                if (automaton.isLive(succ)) {
                    frontier.add(new FrontierRecord<>(append(curr.prefix(), symbol), succ));
                }
            }

            if (automaton.hasFinal(curr.state())) {
                return curr.prefix();
            }
        }
    }

    private static <I> List<Symbol<I>> append(List<Symbol<I>> prefix, Symbol<I> symbol) {
        final List<Symbol<I>> result = new ArrayList<>(prefix.size() + 1);
        result.addAll(prefix);
        result.add(symbol);
        return Collections.unmodifiableList(result);
    }

    private record FrontierRecord<S, I>(List<Symbol<I>> prefix, S state) { }
}
