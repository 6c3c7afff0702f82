/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.talkback.exception.TalkBackException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.talkback.exception.ServicesNotConfiguredException} - Thrown when
 *       a session is started without its audio, STT, LLM or TTS collaborator</li>
 *   <li>{@link com.phillippitts.talkback.exception.SessionStartException} - Thrown when audio I/O
 *       or the STT stream fails to start</li>
 *   <li>{@link com.phillippitts.talkback.exception.GenerationException} - Describes a failed
 *       language-model turn (stream failure or empty response)</li>
 *   <li>{@link com.phillippitts.talkback.exception.SynthesisException} - Describes a failed
 *       sentence synthesis</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining via {@code cause}.
 * Only the first two ever reach a caller; the others are trapped inside the orchestrator
 * and mapped onto the session's error recovery path.
 *
 * @see com.phillippitts.talkback.exception.TalkBackException
 * @since 1.0
 */
package com.phillippitts.talkback.exception;
