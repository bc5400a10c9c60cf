package alpha.nomagicbody.stream;

import java.nio.ByteBuffer;

import static java.util.Objects.requireNonNull;

/**
 * A signal from a stream reader to a {@link ReadRequest}.<p>
 *
 * The event is tagged with a {@link Kind}. A {@code CHUNK} carries the
 * produced {@link #value()}, normally a {@link ByteBuffer} (but the stream
 * does not enforce it), an {@code ERROR} carries the {@link #reason()}, and
 * {@code END} carries nothing. Consumers are expected to switch over the kind:
 *
 * <pre>{@code
 *   switch (event.kind()) {
 *       case CHUNK -> append(event.value());
 *       case END   -> finish();
 *       case ERROR -> fail(event.reason());
 *   }
 * }</pre>
 *
 * @param kind of event
 * @param value the chunk, or {@code null} if kind is not {@code CHUNK}
 * @param reason the error, or {@code null} if kind is not {@code ERROR}
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public record ReadEvent(Kind kind, Object value, Throwable reason)
{
    /**
     * The kind of event.
     */
    public enum Kind {
        /** A chunk was produced. */
        CHUNK,
        /** The stream closed; no more chunks. */
        END,
        /** The stream errored; no more chunks. */
        ERROR;

        /**
         * {@return {@code true} if this kind terminates the stream}
         */
        public boolean isTerminal() {
            return this != CHUNK;
        }
    }

    private static final ReadEvent END = new ReadEvent(Kind.END, null, null);

    /**
     * Constructs this object.
     *
     * @throws NullPointerException
     *             if {@code kind} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code value}/{@code reason} does not match the kind
     */
    public ReadEvent {
        requireNonNull(kind);
        switch (kind) {
            case CHUNK -> {
                if (value == null || reason != null) {
                    throw new IllegalArgumentException("CHUNK needs a value and no reason.");
                }
            }
            case END -> {
                if (value != null || reason != null) {
                    throw new IllegalArgumentException("END carries nothing.");
                }
            }
            case ERROR -> {
                if (value != null || reason == null) {
                    throw new IllegalArgumentException("ERROR needs a reason and no value.");
                }
            }
        }
    }

    /**
     * Creates a chunk event.
     *
     * @param value the chunk
     * @return a chunk event
     *
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static ReadEvent chunk(Object value) {
        return new ReadEvent(Kind.CHUNK, requireNonNull(value), null);
    }

    /**
     * {@return the end event}
     */
    public static ReadEvent end() {
        return END;
    }

    /**
     * Creates an error event.
     *
     * @param reason the error
     * @return an error event
     *
     * @throws NullPointerException if {@code reason} is {@code null}
     */
    public static ReadEvent error(Throwable reason) {
        return new ReadEvent(Kind.ERROR, null, requireNonNull(reason));
    }
}
