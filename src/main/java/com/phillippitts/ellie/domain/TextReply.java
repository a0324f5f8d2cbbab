package com.phillippitts.ellie.domain;

/**
 * Reply to a text-only turn.
 *
 * @param response         reply text
 * @param processingTimeMs total processing time
 * @param provider         provider that produced the text
 * @param fallback         true if the text is a canned fallback reply
 */
public record TextReply(String response, long processingTimeMs, String provider, boolean fallback) {
}
