package com.phillippitts.ellie.client.capture;

/**
 * Fixed-capacity byte ring for captured PCM. When full, the oldest bytes are overwritten.
 * One producer (the capture thread) and one consumer (stop), both synchronized on the buffer.
 */
final class PcmRingBuffer {

    private final byte[] ring;
    private int head; // index of the oldest byte
    private int size;

    PcmRingBuffer(int capacityBytes) {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.ring = new byte[capacityBytes];
    }

    int capacity() {
        return ring.length;
    }

    synchronized int size() {
        return size;
    }

    synchronized void write(byte[] src, int off, int len) {
        if (len <= 0) {
            return;
        }
        if (len >= ring.length) {
            System.arraycopy(src, off + len - ring.length, ring, 0, ring.length);
            head = 0;
            size = ring.length;
            return;
        }
        int overflow = Math.max(0, size + len - ring.length);
        head = (head + overflow) % ring.length;
        size -= overflow;

        int tail = (head + size) % ring.length;
        int first = Math.min(len, ring.length - tail);
        System.arraycopy(src, off, ring, tail, first);
        System.arraycopy(src, off + first, ring, 0, len - first);
        size += len;
    }

    synchronized byte[] snapshot() {
        byte[] out = new byte[size];
        int first = Math.min(size, ring.length - head);
        System.arraycopy(ring, head, out, 0, first);
        System.arraycopy(ring, 0, out, first, size - first);
        return out;
    }

    synchronized void clear() {
        head = 0;
        size = 0;
    }
}
