package org.calista.kinda.loop;

/**
 * Fixed-capacity ring of boolean outcomes. Oldest entry is evicted first; the true count is kept incrementally.
 */
public final class ConfidenceBuffer {

    private final boolean[] slots;
    private int head;      // next write position
    private int size;
    private int trues;

    public ConfidenceBuffer(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        this.slots = new boolean[capacity];
    }

    public void add(boolean outcome) {
        if (size == slots.length) {
            if (slots[head]) trues--;
        } else {
            size++;
        }
        slots[head] = outcome;
        if (outcome) trues++;
        head = (head + 1) % slots.length;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }

    public int trues() {
        return trues;
    }

    public boolean isFull() {
        return size == slots.length;
    }

    public double proportion() {
        return size == 0 ? 0.0 : (double) trues / size;
    }
}
