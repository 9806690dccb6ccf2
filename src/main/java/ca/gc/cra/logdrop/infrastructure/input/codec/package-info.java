/**
 * Wire codecs turning connection bytes into records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.infrastructure.input.codec;
