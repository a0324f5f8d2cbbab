package com.phillippitts.ellie.domain;

import java.util.List;

/**
 * Read-only view of a session's recent history handed to the classifier and the generation
 * providers. A snapshot; later appends to the session do not change it.
 *
 * @param recentMessages     most recent messages, oldest first
 * @param previousComplexity complexity of the previous turn, or null for the first turn
 */
public record ConversationContext(List<Message> recentMessages, ComplexityClass previousComplexity) {

    public ConversationContext {
        recentMessages = recentMessages == null ? List.of() : List.copyOf(recentMessages);
    }

    public static ConversationContext empty() {
        return new ConversationContext(List.of(), null);
    }
}
