/**
 * <strong>Purpose:</strong> Size- and time-triggered batching to a bulk index endpoint.
 * <p><strong>Concurrency:</strong> Each output runs an owner thread and a timer thread; HTTP delivery is
 * asynchronous on Jetty's client threads.</p>
 * <p><strong>Metrics:</strong> {@code output.<name>.bulk.*}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logdrop.infrastructure.output.bulk;
