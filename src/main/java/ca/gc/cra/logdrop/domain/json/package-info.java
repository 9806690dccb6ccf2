/**
 * Streaming JSON parsing for unframed document streams.
 *
 * <p><strong>Role:</strong> Domain parsing; turns characters into {@link ca.gc.cra.logdrop.domain.json.JsonEvent}s
 * and events into {@link ca.gc.cra.logdrop.domain.value.Value} trees.</p>
 * <p><strong>Concurrency:</strong> Parsers and builders are single-threaded; one per input connection.</p>
 * <p><strong>Performance:</strong> Nesting is tracked on heap stacks, so depth is bounded by memory only.</p>
 * <p><strong>Security:</strong> Input is untrusted; malformed text breaks the parser instead of throwing.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.domain.json;
