package fr.lapetina.chat.recovery.coordinator;

import fr.lapetina.chat.recovery.domain.model.ErrorLogEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Fixed-capacity ring of handled errors, oldest evicted first. Not thread-safe.
 */
public final class ErrorHistory {

    public static final int DEFAULT_CAPACITY = 100;

    private final ErrorLogEntry[] ring;
    private int head;
    private int size;

    public ErrorHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.ring = new ErrorLogEntry[capacity];
    }

    public ErrorHistory() {
        this(DEFAULT_CAPACITY);
    }

    public void add(ErrorLogEntry entry) {
        int tail = (head + size) % ring.length;
        ring[tail] = entry;
        if (size < ring.length) {
            size++;
        } else {
            head = (head + 1) % ring.length;
        }
    }

    /**
     * Replaces the newest entry matching the predicate.
     *
     * @return true if an entry was updated
     */
    public boolean updateLast(Predicate<ErrorLogEntry> matcher, UnaryOperator<ErrorLogEntry> update) {
        for (int i = size - 1; i >= 0; i--) {
            int index = (head + i) % ring.length;
            if (matcher.test(ring[index])) {
                ring[index] = update.apply(ring[index]);
                return true;
            }
        }
        return false;
    }

    /**
     * Oldest first.
     */
    public List<ErrorLogEntry> snapshot() {
        List<ErrorLogEntry> entries = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            entries.add(ring[(head + i) % ring.length]);
        }
        return List.copyOf(entries);
    }

    public void clear() {
        for (int i = 0; i < ring.length; i++) {
            ring[i] = null;
        }
        head = 0;
        size = 0;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return ring.length;
    }
}
