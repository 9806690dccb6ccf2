/**
 * Format-string templates with slash-separated field paths.
 *
 * <p><strong>Role:</strong> Domain rendering used by outputs for file paths and lines.</p>
 * <p><strong>Concurrency:</strong> Compiled templates are immutable; tokenizers are single-use.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.domain.template;
