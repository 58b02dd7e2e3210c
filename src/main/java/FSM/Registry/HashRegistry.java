package FSM.Registry;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

public class HashRegistry<T> implements Registry<T> {
    private final Object2IntMap<T> superstate2ID;

    public HashRegistry() {
        this.superstate2ID = new Object2IntOpenHashMap<>();
        this.superstate2ID.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
    }

    @Override
    public int get(T superstate) {
        return superstate2ID.getInt(superstate);
    }

    @Override
    public void put(T superstate, int stateID) {
        superstate2ID.put(superstate, stateID);
    }

    @Override
    public int size() {
        return superstate2ID.size();
    }

    @Override
    public String toString() {
        return "Hash";
    }
}
