/**
 * Asynchronous reading of message bodies.<p>
 *
 * A {@link alpha.nomagicbody.message.Body} pairs a single-reader {@link
 * alpha.nomagicbody.stream.ByteStream} with an optional pre-materialized
 * {@link alpha.nomagicbody.message.Source} and an optional known length. The
 * body is read either fully or incrementally, and all callbacks are delivered
 * through an explicit {@link alpha.nomagicbody.task.TaskDestination}.<p>
 *
 * Configuration of limits is done through {@link alpha.nomagicbody.Config}.
 */
package alpha.nomagicbody;
