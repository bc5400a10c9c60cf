package alpha.nomagicbody.message;

import alpha.nomagicbody.Config;
import alpha.nomagicbody.stream.ByteStream;
import alpha.nomagicbody.stream.ByteStreams;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static java.util.Locale.ROOT;
import static java.util.Objects.requireNonNull;

/**
 * Immutable binary data with a media type.<p>
 *
 * The type is normalized to lower case. A type containing characters outside
 * of printable US-ASCII is replaced with the empty string (type unknown).
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Blob
{
    private final byte[] bytes;
    private final String type;

    /**
     * Constructs a blob of unknown type.
     *
     * @param bytes content (copied)
     *
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public Blob(byte[] bytes) {
        this(bytes, "");
    }

    /**
     * Constructs a blob.
     *
     * @param bytes content (copied)
     * @param type media type, may be empty
     *
     * @throws NullPointerException if any arg is {@code null}
     */
    public Blob(byte[] bytes, String type) {
        this.bytes = bytes.clone();
        this.type  = normalize(type);
    }

    private static String normalize(String type) {
        requireNonNull(type);
        for (int i = 0; i < type.length(); ++i) {
            char c = type.charAt(i);
            if (c < 0x20 || c > 0x7E) {
                return "";
            }
        }
        return type.toLowerCase(ROOT);
    }

    /**
     * {@return the number of bytes}
     */
    public long size() {
        return bytes.length;
    }

    /**
     * {@return the media type, or the empty string if unknown}
     */
    public String type() {
        return type;
    }

    /**
     * {@return a copy of the content}
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    /**
     * Returns a read-only view of the content.<p>
     *
     * The view is synchronously available and never copies.
     *
     * @return a read-only buffer
     */
    public ByteBuffer asReadOnlyBuffer() {
        return ByteBuffer.wrap(bytes).asReadOnlyBuffer();
    }

    /**
     * Returns a new blob containing the bytes in the given range.<p>
     *
     * A negative index counts from the end. Indices are clamped to the size of
     * this blob, and an inverted range yields an empty blob.
     *
     * @param start index, inclusive
     * @param end index, exclusive
     * @param contentType media type of the new blob
     * @return a new blob
     *
     * @throws NullPointerException if {@code contentType} is {@code null}
     */
    public Blob slice(long start, long end, String contentType) {
        int from = clamp(start),
            to   = clamp(end);
        byte[] range = from < to ? Arrays.copyOfRange(bytes, from, to) : new byte[0];
        return new Blob(range, contentType);
    }

    private int clamp(long idx) {
        long abs = idx < 0 ? Math.max(bytes.length + idx, 0) : Math.min(idx, bytes.length);
        return (int) abs;
    }

    /**
     * Returns a stream of the content, using {@link Config#DEFAULT}'s chunk
     * size.
     *
     * @return a new stream
     */
    public ByteStream stream() {
        return stream(Config.DEFAULT.blobChunkSize());
    }

    /**
     * Returns a stream of the content.<p>
     *
     * Each chunk is a buffer over a copy of at most {@code chunkSize} bytes.
     *
     * @param chunkSize max bytes per chunk
     * @return a new stream
     *
     * @throws IllegalArgumentException if {@code chunkSize} is less than 1
     */
    public ByteStream stream(int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("Chunk size less than 1: " + chunkSize);
        }
        List<ByteBuffer> chunks = new ArrayList<>();
        for (int i = 0; i < bytes.length; i += chunkSize) {
            int to = Math.min(i + chunkSize, bytes.length);
            chunks.add(ByteBuffer.wrap(Arrays.copyOfRange(bytes, i, to)));
        }
        return ByteStreams.ofChunks(chunks);
    }

    @Override
    public String toString() {
        return "Blob{size=" + bytes.length + ", type=\"" + type + "\"}";
    }
}
