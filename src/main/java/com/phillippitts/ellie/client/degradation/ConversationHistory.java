package com.phillippitts.ellie.client.degradation;

import com.phillippitts.ellie.domain.Message;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Client-side record of the conversation, kept across voice/text mode switches so the user sees
 * one continuous thread. Bounded; the oldest messages drop first.
 */
public class ConversationHistory {

    private final int maxMessages;
    private final Deque<Message> messages = new ArrayDeque<>();

    public ConversationHistory(int maxMessages) {
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive");
        }
        this.maxMessages = maxMessages;
    }

    public synchronized void add(Message message) {
        messages.addLast(message);
        while (messages.size() > maxMessages) {
            messages.removeFirst();
        }
    }

    public synchronized List<Message> snapshot() {
        return List.copyOf(messages);
    }

    public synchronized int size() {
        return messages.size();
    }
}
