package alpha.nomagicbody.message;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The pre-materialized content of a body, if any.<p>
 *
 * A source is either {@link Kind#EMPTY} (content available only through the
 * body's stream), {@link Kind#BYTES} or {@link Kind#BLOB}. A non-empty
 * source must be byte-for-byte consistent with what the body's stream yields,
 * which allows a full read to skip the stream.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Source
{
    /**
     * The kind of source.
     */
    public enum Kind {
        /** No content materialized. */
        EMPTY,
        /** A byte sequence. */
        BYTES,
        /** A {@link Blob}. */
        BLOB
    }

    private static final Source EMPTY = new Source(Kind.EMPTY, null, null);

    /**
     * {@return the empty source}
     */
    public static Source empty() {
        return EMPTY;
    }

    /**
     * Creates a byte sequence source.
     *
     * @param bytes content (copied)
     * @return a new source
     *
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public static Source of(byte[] bytes) {
        return new Source(Kind.BYTES, bytes.clone(), null);
    }

    /**
     * Creates a blob source.
     *
     * @param blob content
     * @return a new source
     *
     * @throws NullPointerException if {@code blob} is {@code null}
     */
    public static Source of(Blob blob) {
        return new Source(Kind.BLOB, null, requireNonNull(blob));
    }

    private final Kind kind;
    private final byte[] bytes;
    private final Blob blob;

    private Source(Kind kind, byte[] bytes, Blob blob) {
        this.kind = kind;
        this.bytes = bytes;
        this.blob = blob;
    }

    /**
     * {@return the kind of source}
     */
    public Kind kind() {
        return kind;
    }

    /**
     * {@return {@code true} if the source is {@link Kind#EMPTY}}
     */
    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    /**
     * Returns a copy of the content.<p>
     *
     * For a blob source, the blob's bytes are returned.
     *
     * @return a copy of the content, or empty if the source is {@link
     *         Kind#EMPTY}
     */
    public Optional<byte[]> bytes() {
        return switch (kind) {
            case EMPTY -> Optional.empty();
            case BYTES -> Optional.of(bytes.clone());
            case BLOB  -> Optional.of(blob.bytes());
        };
    }

    /**
     * {@return the blob, if this is a blob source}
     */
    public Optional<Blob> blob() {
        return Optional.ofNullable(blob);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case EMPTY -> "Source{EMPTY}";
            case BYTES -> "Source{BYTES, length=" + bytes.length + "}";
            case BLOB  -> "Source{" + blob + "}";
        };
    }
}
