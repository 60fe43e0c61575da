package org.Aayush.probcheck.core.id;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.probcheck.core.error.CapacityException;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Concurrent dense id allocation for serialized model states.
 * <p>
 * Exploration workers insert the successor states they discover; the first insert of a
 * state wins and fixes its storage id. Ids are dense and 0-indexed in insertion order, but
 * their numeric values are arbitrary across parallel runs; only the state itself is the
 * semantic identity.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> {@link #addState(Object)} and all lookups may be called
 * concurrently.
 * </p>
 *
 * @param <S> serialized state type.
 */
public final class StateStorage<S> {
    public static final String REASON_STATE_CAPACITY_EXCEEDED = "ID_STATE_CAPACITY_EXCEEDED";

    // state -> storage id (forward lookup)
    private final ConcurrentHashMap<S, Integer> forward;
    // storage id -> state (reverse lookup); guarded by itself
    private final ObjectArrayList<S> reverse;
    private final int capacity;

    /**
     * @param capacity maximum number of distinct states that may be stored.
     */
    public StateStorage(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.forward = new ConcurrentHashMap<>(Math.min(capacity, 1 << 16));
        this.reverse = new ObjectArrayList<>(Math.min(capacity, 1 << 16));
    }

    /**
     * Inserts {@code state} if absent.
     *
     * @param state state to store.
     * @return the new storage id when the state was added by this call, otherwise
     * {@code -(existingId + 1)}. Use {@link #isNewlyAdded(int)} and {@link #storageId(int)} to decode.
     * @throws CapacityException when the storage is full.
     */
    public int addState(S state) {
        Objects.requireNonNull(state, "state");
        Integer existing = forward.get(state);
        if (existing != null) {
            return -(existing + 1);
        }
        int[] added = {-1};
        int id = forward.computeIfAbsent(state, key -> {
            int allocated = allocate(key);
            added[0] = allocated;
            return allocated;
        });
        return added[0] == id ? id : -(id + 1);
    }

    public static boolean isNewlyAdded(int addResult) {
        return addResult >= 0;
    }

    public static int storageId(int addResult) {
        return addResult >= 0 ? addResult : -addResult - 1;
    }

    private int allocate(S state) {
        synchronized (reverse) {
            int id = reverse.size();
            if (id >= capacity) {
                throw new CapacityException(
                        REASON_STATE_CAPACITY_EXCEEDED,
                        "state storage capacity of " + capacity + " states reached"
                );
            }
            reverse.add(state);
            return id;
        }
    }

    /**
     * Returns the storage id of {@code state}, or {@code -1} when the state is unknown.
     */
    public int indexOf(S state) {
        Integer id = forward.get(state);
        return id == null ? -1 : id;
    }

    /**
     * Returns the state stored under {@code storageId}.
     *
     * @throws IndexOutOfBoundsException when the id was never allocated.
     */
    public S get(int storageId) {
        synchronized (reverse) {
            if (storageId < 0 || storageId >= reverse.size()) {
                throw new IndexOutOfBoundsException("Storage id out of bounds: " + storageId);
            }
            return reverse.get(storageId);
        }
    }

    public int size() {
        synchronized (reverse) {
            return reverse.size();
        }
    }

    public int capacity() {
        return capacity;
    }
}
