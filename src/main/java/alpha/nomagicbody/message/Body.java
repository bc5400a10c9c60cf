package alpha.nomagicbody.message;

import alpha.nomagicbody.Config;
import alpha.nomagicbody.internal.DefaultBody;
import alpha.nomagicbody.stream.ByteStream;
import alpha.nomagicbody.stream.ByteStreams;
import alpha.nomagicbody.stream.ReaderAcquisitionException;
import alpha.nomagicbody.stream.StreamLockedException;
import alpha.nomagicbody.task.TaskDestination;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A message body; a byte stream with an optional pre-materialized source and
 * an optional known length.<p>
 *
 * The body can be consumed in one of two ways. {@link #fullyRead(Consumer,
 * Consumer, TaskDestination) fullyRead} accumulates all bytes and delivers
 * them at once. {@link #incrementallyRead(Consumer, Runnable, Consumer,
 * TaskDestination) incrementallyRead} delivers each chunk as it is produced.
 * Both lock the stream for the remainder of its life; a body can only be
 * consumed once. To consume a body twice, {@link #clone() clone} it first.<p>
 *
 * Every callback is delivered through the given {@link TaskDestination},
 * never synchronously from within the method that registered it, and never
 * from within the stream's own machinery. The byte arrays handed to callbacks
 * are copies the callback may keep.<p>
 *
 * A body is thread-safe. However, {@link #clone()} mutates the body's stream
 * reference, and a concurrent read may or may not observe the new stream.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Body
{
    /**
     * Returns a body of the given bytes.<p>
     *
     * The stream yields one chunk (or none, if the array is empty) and then
     * closes. The source is {@link Source.Kind#BYTES} and the length is the
     * array length.
     *
     * @param bytes content (copied)
     * @return a body
     *
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    static Body of(byte[] bytes) {
        return of(ByteStreams.of(bytes), Source.of(bytes), OptionalLong.of(bytes.length));
    }

    /**
     * Returns a body of the given blob, using the {@linkplain Config#DEFAULT
     * default} configuration.
     *
     * @param blob content
     * @return a body
     *
     * @throws NullPointerException if {@code blob} is {@code null}
     */
    static Body of(Blob blob) {
        return of(blob, Config.DEFAULT);
    }

    /**
     * Returns a body of the given blob.<p>
     *
     * The stream yields the blob's bytes in chunks of at most {@link
     * Config#blobChunkSize()} bytes. The source is {@link Source.Kind#BLOB}
     * and the length is the blob's size.
     *
     * @param blob content
     * @param config configuration
     * @return a body
     *
     * @throws NullPointerException if any arg is {@code null}
     */
    static Body of(Blob blob, Config config) {
        return of(blob.stream(config.blobChunkSize()),
                Source.of(blob), OptionalLong.of(blob.size()), config);
    }

    /**
     * Returns a body of the given stream, of unknown length.
     *
     * @param stream content
     * @return a body
     *
     * @throws NullPointerException if {@code stream} is {@code null}
     */
    static Body of(ByteStream stream) {
        return of(stream, Source.empty(), OptionalLong.empty());
    }

    /**
     * Returns a body, using the {@linkplain Config#DEFAULT default}
     * configuration.
     *
     * @param stream content
     * @param source pre-materialized content, must be consistent with the stream
     * @param length byte count, if known
     * @return a body
     *
     * @throws NullPointerException if any arg is {@code null}
     */
    static Body of(ByteStream stream, Source source, OptionalLong length) {
        return of(stream, source, length, Config.DEFAULT);
    }

    /**
     * Returns a body.
     *
     * @param stream content
     * @param source pre-materialized content, must be consistent with the stream
     * @param length byte count, if known
     * @param config configuration
     * @return a body
     *
     * @throws NullPointerException if any arg is {@code null}
     * @throws IllegalArgumentException if {@code length} is negative
     */
    static Body of(ByteStream stream, Source source, OptionalLong length, Config config) {
        return new DefaultBody(stream, source, length, config);
    }

    /**
     * {@return the current stream}
     *
     * The reference changes when the body is {@linkplain #clone() cloned}.
     */
    ByteStream stream();

    /**
     * {@return the pre-materialized content}
     */
    Source source();

    /**
     * {@return the byte count, if known}
     */
    OptionalLong length();

    /**
     * Returns {@code true} if the body can no longer be read.<p>
     *
     * This is the case if the stream has been read from (disturbed) or is
     * locked to a reader.
     *
     * @return see JavaDoc
     */
    boolean isUnusable();

    /**
     * Reads all bytes of the body.<p>
     *
     * If the source is not {@link Source.Kind#EMPTY}, the source's bytes are
     * delivered; the stream is locked and cancelled without being read.
     * Otherwise, the stream is read until it ends or fails. Either way, the
     * body is unusable afterwards.<p>
     *
     * Exactly one of the callbacks executes, exactly once, on the destination.
     * The error callback receives
     *
     * <ul>
     *   <li>{@link ReaderAcquisitionException} if the stream is locked</li>
     *   <li>{@link ChunkTypeException} if the stream yields a non-{@link
     *       ByteBuffer} chunk</li>
     *   <li>{@link MaxBodyBufferSizeException} if the body is larger than
     *       {@link Config#maxBodyBufferSize()}</li>
     *   <li>whichever error the stream's producer signalled</li>
     * </ul>
     *
     * No bytes are delivered if an error occurs.
     *
     * @param processBody receives all bytes
     * @param processError receives the failure
     * @param destination where callbacks execute
     *
     * @throws NullPointerException if any arg is {@code null}
     */
    void fullyRead(
            Consumer<byte[]> processBody,
            Consumer<Throwable> processError,
            TaskDestination destination);

    /**
     * Reads the body one chunk at a time.<p>
     *
     * A new chunk is not requested from the stream until the callback of the
     * previous chunk has executed. Chunk callbacks execute in stream order,
     * and then either the end callback or the error callback executes once.
     * Nothing executes after that.<p>
     *
     * A non-{@link ByteBuffer} chunk ends the read with a {@link
     * ChunkTypeException}.
     *
     * @param processChunk receives each chunk
     * @param processEnd executes when the stream ends
     * @param processError receives the failure
     * @param destination where callbacks execute
     * @return a handle to stop the read
     *
     * @throws NullPointerException if any arg is {@code null}
     * @throws ReaderAcquisitionException if the stream is locked
     */
    ReadSession incrementallyRead(
            Consumer<byte[]> processChunk,
            Runnable processEnd,
            Consumer<Throwable> processError,
            TaskDestination destination);

    /**
     * Splits the stream in two.<p>
     *
     * This body continues with one branch; the returned body has the other.
     * Both observe the same bytes independently. Source and length are copied
     * as-is.
     *
     * @return a new body
     *
     * @throws StreamLockedException
     *             if the stream is locked (neither body is changed)
     */
    Body clone();

    /**
     * Reads all bytes of the body.<p>
     *
     * The returned stage completes on the destination.
     *
     * @param destination where the stage completes
     * @return all bytes
     *
     * @throws NullPointerException if {@code destination} is {@code null}
     * @see #fullyRead(Consumer, Consumer, TaskDestination)
     */
    default CompletionStage<byte[]> toBytes(TaskDestination destination) {
        var result = new CompletableFuture<byte[]>();
        fullyRead(result::complete, result::completeExceptionally, destination);
        return result;
    }

    /**
     * Reads all bytes of the body as UTF-8 text.
     *
     * @param destination where the stage completes
     * @return the body as text
     *
     * @throws NullPointerException if {@code destination} is {@code null}
     * @see #toText(Charset, TaskDestination)
     */
    default CompletionStage<String> toText(TaskDestination destination) {
        return toText(UTF_8, destination);
    }

    /**
     * Reads all bytes of the body as text.<p>
     *
     * Malformed or unmappable input completes the stage exceptionally with a
     * {@link CharacterCodingException}.
     *
     * @param charset to decode with
     * @param destination where the stage completes
     * @return the body as text
     *
     * @throws NullPointerException if any arg is {@code null}
     */
    default CompletionStage<String> toText(Charset charset, TaskDestination destination) {
        var dec = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return toBytes(destination).thenApply(bytes -> {
            final CharBuffer chars;
            try {
                chars = dec.decode(ByteBuffer.wrap(bytes));
            } catch (CharacterCodingException e) {
                throw new CompletionException(e);
            }
            return chars.toString();
        });
    }

    /**
     * A handle to an incremental read.
     */
    interface ReadSession {
        /**
         * Stops the read.<p>
         *
         * No new chunk is requested and the stream is cancelled. A chunk
         * already in flight is dropped. Neither the end callback nor the error
         * callback will execute.<p>
         *
         * This method is NOP if the read has already completed.
         */
        void stop();

        /**
         * Returns {@code true} if the read has ended, failed or been stopped.<p>
         *
         * Ended and failed means that the final callback has been queued, not
         * necessarily executed.
         *
         * @return see JavaDoc
         */
        boolean isDone();
    }
}
