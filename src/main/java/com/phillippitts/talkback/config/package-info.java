/**
 * Spring configuration: worker pool, orchestration wiring and typed properties.
 *
 * @since 1.0
 */
package com.phillippitts.talkback.config;
