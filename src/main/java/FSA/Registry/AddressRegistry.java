package FSA.Registry;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;

public class AddressRegistry<K> implements Registry<K> {
    private final Object2IntMap<K> key2Address;
    private final List<K> keys;
    private final List<String> labels;
    private final ObjectOpenHashSet<String> taken;
    private final Function<? super K, String> namer;

    public AddressRegistry(Function<? super K, String> namer) {
        this(namer, Collections.emptySet());
    }

    /**
     * @param namer readable base label of a key
     * @param reserved labels that must not be handed out
     */
    public AddressRegistry(Function<? super K, String> namer, Collection<String> reserved) {
        this.key2Address = new Object2IntOpenHashMap<>();
        this.key2Address.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.keys = new ObjectArrayList<>();
        this.labels = new ObjectArrayList<>();
        this.taken = new ObjectOpenHashSet<>(reserved);
        this.namer = namer;
    }

    @Override
    public int get(K key) {
        return key2Address.getInt(key);
    }

    @Override
    public int put(K key) {
        if (key2Address.containsKey(key)) {
            throw new IllegalStateException("Key already registered: " + key);
        }
        int address = keys.size();
        key2Address.put(key, address);
        keys.add(key);
        labels.add(fresh(namer.apply(key)));
        return address;
    }

    @Override
    public String label(int address) {
        return labels.get(address);
    }

    @Override
    public K key(int address) {
        return keys.get(address);
    }

    @Override
    public int size() {
        return keys.size();
    }

    @Override
    public List<String> labels() {
        return Collections.unmodifiableList(labels);
    }

    /**
     * Reserve a label derived from {@code base} that no key or reserved label uses.
     * Distinct keys may have equal readable names, e.g. the pair ("a,b", "c") and ("a", "b,c").
     */
    public String fresh(String base) {
        String candidate = base;
        while (!taken.add(candidate)) {
            candidate += Labels.PRIME;
        }
        return candidate;
    }

    @Override
    public String toString() {
        return "AddressRegistry" + labels;
    }
}
