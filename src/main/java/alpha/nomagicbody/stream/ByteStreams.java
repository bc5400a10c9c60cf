package alpha.nomagicbody.stream;

import java.nio.ByteBuffer;
import java.util.List;

import static alpha.nomagicbody.util.ByteBuffers.wrapCopy;
import static java.util.Objects.requireNonNull;

/**
 * Factories of {@link ByteStream}.<p>
 *
 * Streams created from static content ({@link #of(byte[])}, {@link
 * #of(ByteBuffer...)}, {@link #ofChunks(List)}) have all their chunks queued
 * and the close requested at creation time. A producer-driven stream is
 * created using {@link #create(ByteStream.UnderlyingSource)}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ByteStreams
{
    private ByteStreams() {
        // Empty
    }

    /**
     * Creates a stream driven by the given source.
     *
     * @param source of chunks
     * @return a new stream
     *
     * @throws NullPointerException if {@code source} is {@code null}
     */
    public static ByteStream create(ByteStream.UnderlyingSource source) {
        return new DefaultByteStream(source).start();
    }

    /**
     * Creates a stream that yields a copy of the given bytes once, then
     * closes.<p>
     *
     * An empty array yields no chunk at all.
     *
     * @param bytes content
     * @return a new stream
     *
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public static ByteStream of(byte[] bytes) {
        requireNonNull(bytes);
        return bytes.length == 0 ? empty() : ofChunks(List.of(wrapCopy(bytes)));
    }

    /**
     * Creates a stream that yields the given buffers, then closes.<p>
     *
     * The buffers are not copied.
     *
     * @param chunks content
     * @return a new stream
     *
     * @throws NullPointerException if any arg is {@code null}
     */
    public static ByteStream of(ByteBuffer... chunks) {
        return ofChunks(List.of(chunks));
    }

    /**
     * Creates a stream that yields the given chunks, then closes.<p>
     *
     * The chunks are normally instances of {@code ByteBuffer}, but any
     * non-null object is accepted.
     *
     * @param chunks content
     * @return a new stream
     *
     * @throws NullPointerException if any arg is {@code null}
     */
    public static ByteStream ofChunks(List<?> chunks) {
        final List<?> copy = List.copyOf(chunks);
        return create(new ByteStream.UnderlyingSource() {
            @Override
            public void start(ByteStream.Controller controller) {
                copy.forEach(controller::enqueue);
                controller.close();
            }
        });
    }

    /**
     * {@return a new stream that is closed without yielding any chunk}
     */
    public static ByteStream empty() {
        return ofChunks(List.of());
    }

    /**
     * Creates a stream that errors without yielding any chunk.
     *
     * @param reason the producer error
     * @return a new stream
     *
     * @throws NullPointerException if {@code reason} is {@code null}
     */
    public static ByteStream failed(Throwable reason) {
        requireNonNull(reason);
        return create(new ByteStream.UnderlyingSource() {
            @Override
            public void start(ByteStream.Controller controller) {
                controller.error(reason);
            }
        });
    }
}
