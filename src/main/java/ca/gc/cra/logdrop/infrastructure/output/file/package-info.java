/**
 * Template-routed file output with handles cached by file identity.
 *
 * <p><strong>Concurrency:</strong> Single-threaded; owned by one dispatcher worker.</p>
 * <p><strong>Security:</strong> Paths come from record fields; operators should anchor path templates under a
 * fixed directory.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.infrastructure.output.file;
