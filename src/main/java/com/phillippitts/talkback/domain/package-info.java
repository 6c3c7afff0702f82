/**
 * Immutable domain model of a voice conversation: session state, conversation history,
 * and the values exchanged with audio, speech-to-text, language-model and synthesis providers.
 *
 * <p>Records validate their components in compact constructors and reject nulls early.
 *
 * @since 1.0
 */
package com.phillippitts.talkback.domain;
