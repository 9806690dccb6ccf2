/**
 * TCP listener input.
 *
 * <p><strong>Concurrency:</strong> One accept loop plus one thread per connection.</p>
 * <p><strong>Security:</strong> No authentication; bind to trusted interfaces only.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.infrastructure.input.tcp;
