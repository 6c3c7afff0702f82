/**
 * Blocking stream abstraction shared by all provider contracts.
 *
 * @since 1.0
 */
package com.phillippitts.talkback.service.stream;
