package com.cryptsync.handler;

import com.cryptsync.protocol.MessageType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Bounded queue of serialized frames waiting for one connection.
 *
 * Overflow policy:
 * 1. Evict the oldest droppable frame (CHAT_MESSAGE, SYSTEM) to make room
 * 2. If nothing is droppable, discard the incoming frame if it is droppable
 * 3. A critical frame (state, errors, replies) that still does not fit puts
 *    the queue into the overflowed state: queued frames are discarded and
 *    every later offer is refused. The owner must close the connection; the
 *    client recovers through RECONNECT, which sends a full STATE.
 *
 * The queue never holds more than {@code capacity} frames.
 *
 * Thread Safety:
 * - All methods synchronize on the queue. Producers are session executors,
 *   the consumer is the channel's event loop.
 */
public class OutboundQueue {

    private final int capacity;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private long dropped;
    private boolean overflowed;

    /**
     * What happened to an offered frame.
     */
    public enum Offer {
        QUEUED,
        DROPPED,
        OVERFLOW
    }

    public OutboundQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public synchronized Offer offer(MessageType type, String json) {
        if (overflowed) {
            return Offer.OVERFLOW;
        }
        if (frames.size() >= capacity) {
            if (evictOldestDroppable()) {
                dropped++;
            } else if (type.isDroppable()) {
                dropped++;
                return Offer.DROPPED;
            } else {
                overflowed = true;
                dropped += frames.size() + 1;
                frames.clear();
                return Offer.OVERFLOW;
            }
        }
        frames.addLast(new Frame(type, json));
        return Offer.QUEUED;
    }

    public synchronized Frame poll() {
        return frames.pollFirst();
    }

    public synchronized int size() {
        return frames.size();
    }

    public synchronized boolean isEmpty() {
        return frames.isEmpty();
    }

    /**
     * True once a critical frame could not be queued.
     */
    public synchronized boolean isOverflowed() {
        return overflowed;
    }

    public synchronized void clear() {
        frames.clear();
    }

    /**
     * Frames discarded because the queue was full.
     */
    public synchronized long getDroppedCount() {
        return dropped;
    }

    public int getCapacity() {
        return capacity;
    }

    private boolean evictOldestDroppable() {
        Iterator<Frame> it = frames.iterator();
        while (it.hasNext()) {
            if (it.next().type.isDroppable()) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    /**
     * A serialized outbound message.
     */
    public static final class Frame {
        private final MessageType type;
        private final String json;

        Frame(MessageType type, String json) {
            this.type = type;
            this.json = json;
        }

        public MessageType getType() {
            return type;
        }

        public String getJson() {
            return json;
        }
    }
}
