/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.ellie.exception.EllieException} and carry an
 * {@link com.phillippitts.ellie.exception.ErrorCode} that is sent to clients in {@code error}
 * events and REST error bodies.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.ellie.exception.CaptureException} - microphone could not be acquired
 *       ({@link com.phillippitts.ellie.exception.CaptureError})</li>
 *   <li>{@link com.phillippitts.ellie.exception.TransportException} - session transport failures
 *       ({@link com.phillippitts.ellie.exception.TransportError})</li>
 *   <li>{@link com.phillippitts.ellie.exception.InvalidAudioException} - audio rejected by validation</li>
 *   <li>{@link com.phillippitts.ellie.exception.ProviderException} and its subtypes
 *       {@link com.phillippitts.ellie.exception.ProviderTimeoutException} and
 *       {@link com.phillippitts.ellie.exception.ProviderUnavailableException} - upstream failures that
 *       enter the fallback chain</li>
 *   <li>{@link com.phillippitts.ellie.exception.ClassificationException} - classifier failure, routed as
 *       MODERATE</li>
 *   <li>{@link com.phillippitts.ellie.exception.CacheException} - non-fatal, treated as a cache miss</li>
 * </ul>
 *
 * @see com.phillippitts.ellie.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.ellie.exception;
