/**
 * The library-provided body implementation.<p>
 *
 * The only public type in this package is {@link
 * alpha.nomagicbody.internal.DefaultBody}, which is used by the {@link
 * alpha.nomagicbody.message.Body} interface as the default implementation. All
 * other types in this package can therefore be regarded as an implementation
 * detail.<p>
 *
 * Similar to types found in other packages, implementations of the API provided
 * by this package also use the "Default" name-prefix.
 *
 *
 * <h2>Threading model</h2>
 *
 * Read requests are invoked by the stream's driver, serially, on whichever
 * thread drives the stream at the time. Consumer callbacks are never invoked
 * from there; they are queued on the caller's task destination. An
 * incremental read issues its next read request from the task that delivered
 * the previous chunk, so at most one chunk per read session is ever in
 * flight.
 */
package alpha.nomagicbody.internal;
