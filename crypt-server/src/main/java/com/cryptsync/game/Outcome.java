package com.cryptsync.game;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Result of executing a {@link GameAction}.
 */
public final class Outcome {

    private final boolean success;
    private final List<String> messages;

    private Outcome(boolean success, List<String> messages) {
        this.success = success;
        this.messages = Collections.unmodifiableList(messages);
    }

    public static Outcome success(String... messages) {
        return new Outcome(true, Arrays.asList(messages));
    }

    public static Outcome failure(String reason) {
        return new Outcome(false, Collections.singletonList(reason));
    }

    public boolean isSuccess() {
        return success;
    }

    public List<String> getMessages() {
        return messages;
    }

    @Override
    public String toString() {
        return "Outcome{success=" + success + ", messages=" + messages + '}';
    }
}
