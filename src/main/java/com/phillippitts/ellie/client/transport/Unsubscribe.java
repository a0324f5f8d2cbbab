package com.phillippitts.ellie.client.transport;

/**
 * Handle returned by {@link SessionTransport#on}. Idempotent.
 */
@FunctionalInterface
public interface Unsubscribe {
    void unsubscribe();
}
