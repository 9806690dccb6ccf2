/**
 * <strong>Purpose:</strong> Output adapters implementing {@link ca.gc.cra.logdrop.application.port.OutputPort}.
 * <p><strong>Pipeline role:</strong> Sink side of the router; {@code file} and {@code bulk} subpackages hold the
 * file and bulk-index outputs.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.infrastructure.output;
