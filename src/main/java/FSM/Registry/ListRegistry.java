package FSM.Registry;

import java.util.ArrayList;
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Linear-scan registry comparing superstates with equals only.
 * Useful for superstates whose hashCode is expensive or unreliable; O(n) per lookup.
 */
public class ListRegistry<T> implements Registry<T> {
    private final List<T> superstates;
    private final IntList stateIDs;

    public ListRegistry() {
        this.superstates = new ArrayList<>();
        this.stateIDs = new IntArrayList();
    }

    @Override
    public int get(T superstate) {
        int index = superstates.indexOf(superstate);
        return index < 0 ? MISSING_ELEMENT : stateIDs.getInt(index);
    }

    @Override
    public void put(T superstate, int stateID) {
        superstates.add(superstate);
        stateIDs.add(stateID);
    }

    @Override
    public int size() {
        return superstates.size();
    }

    @Override
    public String toString() {
        return "List";
    }
}
