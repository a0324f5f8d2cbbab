package com.phillippitts.ellie.service.classify;

import com.phillippitts.ellie.domain.ComplexityClass;
import com.phillippitts.ellie.domain.ConversationContext;
import com.phillippitts.ellie.exception.ClassificationException;

/**
 * Assigns a routing class to a transcript.
 *
 * <p>Implementations must be deterministic: identical {@code (transcript, context)} pairs always yield
 * the same class. Cache keys and routing tests depend on it.
 */
public interface ComplexityClassifier {

    /**
     * @param transcript user text, never null
     * @param context    snapshot of the session's recent history
     * @return complexity class of the turn
     * @throws ClassificationException if the transcript cannot be classified
     */
    ComplexityClass classify(String transcript, ConversationContext context);
}
