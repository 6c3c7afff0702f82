/**
 * Audio I/O contract and PCM helpers.
 *
 * <ul>
 *   <li>{@link com.phillippitts.talkback.service.audio.AudioIo} - capture with VAD and playback
 *       with pause/resume/stop</li>
 *   <li>{@link com.phillippitts.talkback.service.audio.AudioFormat} - negotiated PCM format</li>
 *   <li>{@link com.phillippitts.talkback.service.audio.AudioLevelMeter} - dBFS input level</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.talkback.service.audio;
