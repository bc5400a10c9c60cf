package alpha.nomagicbody.stream;

/**
 * A single-producer, pull-based sequence of chunks.<p>
 *
 * A stream produces zero or more chunks followed by exactly one terminal
 * event; close or error. Chunks are consumed through a {@link Reader}, of
 * which at most one may be active at any given moment. While a reader is
 * active, the stream is <i>locked</i>.<p>
 *
 * A stream can be {@linkplain #tee() teed} into two branches, each of which
 * independently yields the same chunks. Teeing locks the stream
 * permanently.<p>
 *
 * Streams are created using {@link ByteStreams}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface ByteStream
{
    /**
     * The state of a stream.
     */
    enum State {
        /** Chunks may be available now or in the future. */
        READABLE,
        /** All chunks have been consumed, or the stream was cancelled. */
        CLOSED,
        /** The producer failed. */
        ERRORED
    }

    /**
     * Two branches of a teed stream.
     *
     * @param first branch
     * @param second branch
     */
    record Branches(ByteStream first, ByteStream second) {}

    /**
     * Acquires a reader, locking the stream to it.<p>
     *
     * A stream that has never been read nor cancelled can be acquired even
     * if it is already {@link State#CLOSED} or {@link State#ERRORED}; the
     * first read then yields the end or the error.
     *
     * @return a reader
     *
     * @throws ReaderAcquisitionException
     *             if the stream is locked, or
     *             if the stream is disturbed and no longer {@link
     *             State#READABLE} (it has been consumed or cancelled)
     */
    Reader getReader();

    /**
     * Splits this stream into two branches.<p>
     *
     * This stream is locked permanently. Each chunk produced by this stream is
     * copied to both branches. A branch that is consumed slower than the other
     * buffers the chunks not yet read. Cancelling one branch stops feeding it,
     * cancelling both cancels this stream.
     *
     * @return the branches
     *
     * @throws StreamLockedException
     *             if the stream is locked
     */
    Branches tee();

    /**
     * Cancels this stream.<p>
     *
     * Queued chunks are discarded and the stream closes. The producer is
     * notified with the given reason.
     *
     * @param reason why
     *
     * @throws NullPointerException
     *             if {@code reason} is {@code null}
     * @throws StreamLockedException
     *             if the stream is locked (cancel through the reader instead)
     */
    void cancel(Throwable reason);

    /**
     * {@return the current state}
     */
    State state();

    /**
     * {@return {@code true} if a reader is active or the stream has been teed}
     */
    boolean isLocked();

    /**
     * {@return {@code true} if a read or cancel has ever been issued}
     */
    boolean isDisturbed();

    /**
     * A stream's exclusive reader.
     */
    interface Reader {
        /**
         * Reads a chunk.<p>
         *
         * The given request is invoked exactly once; with a chunk, the end or
         * an error. If a chunk is already queued, the request may be invoked
         * before this method returns. Multiple reads may be outstanding;
         * they are fulfilled in order.
         *
         * @param request to invoke
         *
         * @throws NullPointerException
         *             if {@code request} is {@code null}
         * @throws IllegalStateException
         *             if the lock has been released
         */
        void read(ReadRequest request);

        /**
         * Cancels the stream.<p>
         *
         * Outstanding reads are fulfilled with the end event. The reader
         * remains locked.
         *
         * @param reason why
         *
         * @throws NullPointerException
         *             if {@code reason} is {@code null}
         * @throws IllegalStateException
         *             if the lock has been released
         */
        void cancel(Throwable reason);

        /**
         * Releases the lock, making the stream available to a new reader.
         *
         * @throws IllegalStateException
         *             if a read is outstanding
         */
        void releaseLock();
    }

    /**
     * The producer's handle to a stream.
     */
    interface Controller {
        /**
         * Enqueues a chunk.
         *
         * @param chunk to enqueue
         *
         * @throws NullPointerException
         *             if {@code chunk} is {@code null}
         * @throws IllegalStateException
         *             if the stream has been closed, errored or cancelled
         */
        void enqueue(Object chunk);

        /**
         * Closes the stream after all queued chunks have been read.
         *
         * @throws IllegalStateException
         *             if the stream has been closed, errored or cancelled
         */
        void close();

        /**
         * Errors the stream. Queued chunks are discarded.
         *
         * @param reason the producer error
         *
         * @throws NullPointerException
         *             if {@code reason} is {@code null}
         * @throws IllegalStateException
         *             if the stream has been closed, errored or cancelled
         */
        void error(Throwable reason);
    }

    /**
     * The producer of a stream.<p>
     *
     * All methods are called serially by the stream driver.
     */
    interface UnderlyingSource {
        /**
         * Called once, when the stream is created.
         *
         * @param controller of the stream
         */
        default void start(Controller controller) {
            // Empty
        }

        /**
         * Called when a read is waiting on an empty queue.<p>
         *
         * The source may enqueue synchronously or at any time later. The
         * method is not called again until a chunk has been enqueued. If the
         * method throws, the stream errors with the exception.
         *
         * @param controller of the stream
         */
        default void pull(Controller controller) {
            // Empty
        }

        /**
         * Called when the consumer cancels the stream.
         *
         * @param reason given by the consumer
         */
        default void cancel(Throwable reason) {
            // Empty
        }
    }
}
