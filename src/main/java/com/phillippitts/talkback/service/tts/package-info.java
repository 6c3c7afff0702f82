/**
 * Speech synthesis contract and the prefetched audio value type.
 *
 * @since 1.0
 */
package com.phillippitts.talkback.service.tts;
