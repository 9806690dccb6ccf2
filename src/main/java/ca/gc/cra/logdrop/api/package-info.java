/**
 * <strong>Purpose:</strong> Command-line entry points for the {@code logdrop} router.
 * <p><strong>Pipeline role:</strong> Parses arguments, loads YAML configuration, and hands it to
 * {@link ca.gc.cra.logdrop.config.CompositionRoot}.
 * <p><strong>Observability:</strong> Errors are logged through SLF4J; usage and dry-run plans go to stdout.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.api;
