/**
 * <strong>Purpose:</strong> Router configuration model, YAML loading, and the composition root.
 * <p><strong>Pipeline role:</strong> Turns a YAML document into validated records and wires inputs, the
 * dispatcher, and outputs from them.
 * <p><strong>Concurrency:</strong> Configuration records are immutable; {@link ca.gc.cra.logdrop.config.CompositionRoot}
 * owns the threads it starts.
 * <p><strong>Observability:</strong> Invalid configuration raises {@link java.lang.IllegalArgumentException}
 * before any thread starts.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.config;
