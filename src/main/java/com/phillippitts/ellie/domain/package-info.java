/**
 * Domain models shared by the server pipeline and the client library.
 *
 * <p>All models are immutable records that validate in their compact constructors.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.ellie.domain.AudioInput} - one captured utterance</li>
 *   <li>{@link com.phillippitts.ellie.domain.AudioResponse} - bundled reply for a voice turn</li>
 *   <li>{@link com.phillippitts.ellie.domain.Message} - entry of a session's conversation history</li>
 *   <li>{@link com.phillippitts.ellie.domain.ComplexityClass} - routing class of a turn</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.ellie.domain;
