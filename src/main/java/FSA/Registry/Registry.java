package FSA.Registry;

import java.util.List;

/**
 * Assigns each internal key of a construction (a state pair, a subset of states, a block) a stable address
 * and a unique output state label.
 *
 * @param <K> key type; keys must not be mutated after registration
 */
public interface Registry<K> {
    int MISSING_ELEMENT = -1;

    /**
     * @param key internal key
     * @return address of the key or MISSING_ELEMENT if the key was never registered.
     */
    int get(K key);

    /**
     * Register a new key and give it a fresh label.
     * @param key internal key, not yet registered
     * @return address of the key
     */
    int put(K key);

    /**
     * @param address address returned by {@link #put(Object)}
     * @return output label of the key at {@code address}
     */
    String label(int address);

    K key(int address);

    int size();

    /**
     * @return labels in registration order
     */
    List<String> labels();

    default String labelOf(K key) {
        int address = get(key);
        return address == MISSING_ELEMENT ? null : label(address);
    }

    default boolean contains(K key) {
        return get(key) != MISSING_ELEMENT;
    }
}
