/**
 * <strong>Purpose:</strong> Validation helpers used while loading configuration and parsing arguments.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Rejects control characters before values reach thread names, metric keys, or
 * file paths.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.validation;
