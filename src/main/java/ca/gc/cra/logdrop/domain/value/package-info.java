/**
 * Immutable value tree and record envelope shared by every stage of the router.
 * <p><strong>Role:</strong> Domain model; produced by the JSON builder and input codecs, consumed by outputs.</p>
 * <p><strong>Concurrency:</strong> All types are deeply immutable and safe to share across output threads.</p>
 * <p><strong>Performance:</strong> Containers copy once on construction; fan-out shares instances.</p>
 */
package ca.gc.cra.logdrop.domain.value;
