package com.phillippitts.ellie.service.orchestration;

/**
 * Outcome of walking the generation chain.
 *
 * @param text               generated reply, or null when every provider failed
 * @param provider           provider that produced the reply, or null
 * @param allUnavailable     true when every provider was shed without being called
 * @param lastFailedProvider last provider that failed, or null
 */
public record RoutingResult(String text, String provider, boolean allUnavailable, String lastFailedProvider) {

    static RoutingResult success(String text, String provider, String lastFailedProvider) {
        return new RoutingResult(text, provider, false, lastFailedProvider);
    }

    static RoutingResult exhausted(boolean allUnavailable, String lastFailedProvider) {
        return new RoutingResult(null, null, allUnavailable, lastFailedProvider);
    }

    public boolean succeeded() {
        return text != null;
    }
}
