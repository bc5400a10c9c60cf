package alpha.nomagicbody.message;

import alpha.nomagicbody.Config;
import alpha.nomagicbody.internal.DefaultBody;
import alpha.nomagicbody.stream.ByteStream;
import alpha.nomagicbody.stream.ByteStreams;
import alpha.nomagicbody.stream.ReaderAcquisitionException;
import alpha.nomagicbody.stream.StreamLockedException;
import alpha.nomagicbody.task.DestinationClosedException;
import alpha.nomagicbody.task.TaskDestination;
import alpha.nomagicbody.task.TaskQueue;
import alpha.nomagicbody.testutil.LogRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.System.Logger.Level.WARNING;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Body}.<p>
 *
 * All callbacks are queued on a {@link TaskQueue} which the test drains
 * manually.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class BodyTest
{
    private final TaskQueue queue = new TaskQueue();
    private final List<String> trace = new ArrayList<>();
    private LogRecorder log;

    @AfterEach
    void stopRecording() {
        if (log != null) {
            log.stopRecording();
        }
    }

    // Callbacks that record into the trace

    private void onBody(byte[] b) {
        trace.add("body " + Arrays.toString(b));
    }

    private void onChunk(byte[] b) {
        trace.add("chunk " + Arrays.toString(b));
    }

    private void onEnd() {
        trace.add("end");
    }

    private void onError(Throwable t) {
        trace.add("error " + t.getClass().getSimpleName() + ": " + t.getMessage());
    }

    private void fullyRead(Body b) {
        b.fullyRead(this::onBody, this::onError, queue);
    }

    private Body.ReadSession incrementallyRead(Body b) {
        return b.incrementallyRead(this::onChunk, this::onEnd, this::onError, queue);
    }

    private static Body ofChunks(byte[]... chunks) {
        return Body.of(ByteStreams.of(
                Arrays.stream(chunks).map(ByteBuffer::wrap).toArray(ByteBuffer[]::new)));
    }

    @Test
    void fullyRead_byteSequence() {
        var body = Body.of(new byte[]{0x61, 0x62, 0x63});
        assertThat(body.source().kind()).isEqualTo(Source.Kind.BYTES);
        assertThat(body.length()).hasValue(3);

        fullyRead(body);
        // Never synchronous
        assertThat(trace).isEmpty();
        assertThat(queue.runPending()).isOne();
        assertThat(trace).containsExactly("body [97, 98, 99]");
        // Source was used, stream is consumed all the same
        assertThat(body.stream().isDisturbed()).isTrue();
        assertThat(body.stream().isLocked()).isTrue();
        assertThat(body.isUnusable()).isTrue();
    }

    @Test
    void byteSequence_consumedOnlyOnce() {
        var body = Body.of(new byte[]{0x61, 0x62, 0x63});
        fullyRead(body);
        queue.runPending();

        fullyRead(body);
        assertThatThrownBy(() -> incrementallyRead(body))
                .isExactlyInstanceOf(ReaderAcquisitionException.class)
                .hasMessage("Stream is CLOSED and disturbed.");
        queue.runPending();
        assertThat(trace).containsExactly(
                "body [97, 98, 99]",
                "error ReaderAcquisitionException: Stream is CLOSED and disturbed.");
    }

    @Test
    void byteSequence_locked_errorNotBytes() {
        var body = Body.of(new byte[]{1});
        incrementallyRead(body);
        fullyRead(body);
        queue.runPending();
        assertThat(trace).containsExactly(
                "chunk [1]",
                "error ReaderAcquisitionException: Stream is locked to a reader.",
                "end");
    }

    @Test
    void fullyRead_emptyByteSequence() {
        fullyRead(Body.of(new byte[0]));
        queue.runPending();
        assertThat(trace).containsExactly("body []");
    }

    @Test
    void fullyRead_stream() {
        var body = ofChunks(new byte[]{1, 2}, new byte[]{3}, new byte[0]);
        fullyRead(body);
        assertThat(trace).isEmpty();
        queue.runPending();
        assertThat(trace).containsExactly("body [1, 2, 3]");
        assertThat(body.stream().isLocked()).isTrue();
        assertThat(body.isUnusable()).isTrue();
    }

    @Test
    void fullyRead_errorAfterChunks_noPartialBytes() {
        var body = Body.of(failingAfter(2, new IOException("boom")));
        fullyRead(body);
        queue.runPending();
        assertThat(trace).containsExactly("error IOException: boom");
    }

    @Test
    void incrementallyRead_chunksThenEnd() {
        var body = ofChunks(new byte[]{1, 2}, new byte[]{3}, new byte[0]);
        var session = incrementallyRead(body);
        // Next read not issued until the chunk's continuation has run
        assertThat(queue.size()).isOne();
        assertThat(queue.runNext()).isTrue();
        assertThat(trace).containsExactly("chunk [1, 2]");
        assertThat(queue.size()).isOne();

        queue.runPending();
        assertThat(trace).containsExactly(
                "chunk [1, 2]", "chunk [3]", "chunk []", "end");
        assertThat(session.isDone()).isTrue();
        assertThat(queue.size()).isZero();
    }

    @Test
    void sameProducer_fullyRead() {
        // Same data as the previous test, but read in full
        fullyRead(ofChunks(new byte[]{1, 2}, new byte[]{3}, new byte[0]));
        queue.runPending();
        assertThat(trace).containsExactly("body [1, 2, 3]");
    }

    @Test
    void incrementallyRead_errorAfterChunks() {
        var boom = new IOException("boom");
        var body = Body.of(failingAfter(2, boom));
        var session = incrementallyRead(body);
        queue.runPending();
        assertThat(trace).containsExactly(
                "chunk [1]", "chunk [2]", "error IOException: boom");
        assertThat(session.isDone()).isTrue();
    }

    @Test
    void incrementallyRead_wrongChunkType() {
        var body = Body.of(ByteStreams.ofChunks(List.of(ByteBuffer.wrap(new byte[]{1}), "x")));
        incrementallyRead(body);
        queue.runPending();
        assertThat(trace).containsExactly(
                "chunk [1]",
                "error ChunkTypeException: Chunk is not a ByteBuffer: java.lang.String");
    }

    @Test
    void fullyRead_wrongChunkType() {
        var body = Body.of(ByteStreams.ofChunks(List.of(ByteBuffer.wrap(new byte[]{1}), 123)));
        fullyRead(body);
        queue.runPending();
        assertThat(trace).containsExactly(
                "error ChunkTypeException: Chunk is not a ByteBuffer: java.lang.Integer");
    }

    @Test
    void incrementallyRead_chunkIsCopy() {
        var backing = new byte[]{5};
        var body = Body.of(ByteStreams.of(ByteBuffer.wrap(backing)));
        var seen = new ArrayList<byte[]>();
        body.incrementallyRead(seen::add, () -> {}, this::onError, queue);
        backing[0] = 6;
        queue.runPending();
        assertThat(seen).hasSize(1);
        assertThat(seen.get(0)).containsExactly(5);
    }

    @Test
    void stop_dropsInFlightChunk() {
        var body = ofChunks(new byte[]{1}, new byte[]{2}, new byte[]{3});
        var session = incrementallyRead(body);
        queue.runNext();
        assertThat(session.isDone()).isFalse();
        // Chunk [2] already queued
        session.stop();
        assertThat(session.isDone()).isTrue();
        queue.runPending();
        assertThat(trace).containsExactly("chunk [1]");
        assertThat(body.stream().state()).isEqualTo(ByteStream.State.CLOSED);
    }

    @Test
    void stop_afterEnd_isNop() {
        var session = incrementallyRead(ofChunks(new byte[]{1}));
        queue.runPending();
        session.stop();
        assertThat(trace).containsExactly("chunk [1]", "end");
        assertThat(session.isDone()).isTrue();
    }

    @Test
    void secondReaderAcquisition_fails() {
        var body = ofChunks(new byte[]{1});
        incrementallyRead(body);
        assertThatThrownBy(() -> incrementallyRead(body))
                .isExactlyInstanceOf(ReaderAcquisitionException.class)
                .hasMessage("Stream is locked to a reader.");
    }

    @Test
    void fullyRead_lockedStream_errorIsQueued() {
        var body = ofChunks(new byte[]{1});
        body.stream().getReader();
        fullyRead(body);
        assertThat(trace).isEmpty();
        queue.runPending();
        assertThat(trace).containsExactly(
                "error ReaderAcquisitionException: Stream is locked to a reader.");
    }

    @Test
    void clone_independence() {
        var original = ofChunks(new byte[]{1, 2}, new byte[]{3});
        var clone = original.clone();
        assertThat(clone.source()).isSameAs(original.source());
        assertThat(clone.length()).isEqualTo(original.length());

        // Interleave, clone first
        fullyRead(clone);
        incrementallyRead(original);
        queue.runPending();
        assertThat(trace).containsExactlyInAnyOrder(
                "body [1, 2, 3]", "chunk [1, 2]", "chunk [3]", "end");
        assertThat(trace.indexOf("chunk [1, 2]")).isLessThan(trace.indexOf("chunk [3]"));
        assertThat(trace.indexOf("chunk [3]")).isLessThan(trace.indexOf("end"));
    }

    @Test
    void clone_ofClone() {
        var a = ofChunks(new byte[]{9});
        var b = a.clone();
        var c = b.clone();
        fullyRead(a);
        fullyRead(b);
        fullyRead(c);
        queue.runPending();
        assertThat(trace).containsExactly("body [9]", "body [9]", "body [9]");
    }

    @Test
    void clone_duringActiveRead_fails_sessionUnaffected() {
        var body = ofChunks(new byte[]{1}, new byte[]{2});
        var streamBefore = body.stream();
        var session = incrementallyRead(body);
        assertThatThrownBy(body::clone)
                .isExactlyInstanceOf(StreamLockedException.class)
                .hasMessage("Stream is locked to a reader.");
        assertThat(body.stream()).isSameAs(streamBefore);
        queue.runPending();
        assertThat(trace).containsExactly("chunk [1]", "chunk [2]", "end");
        assertThat(session.isDone()).isTrue();
    }

    @Test
    void maxBodyBufferSize_duringRead() {
        var cfg = Config.configuration().maxBodyBufferSize(2).build();
        var body = Body.of(ByteStreams.of(ByteBuffer.wrap(new byte[]{1, 2}), ByteBuffer.wrap(new byte[]{3})),
                Source.empty(), OptionalLong.empty(), cfg);
        fullyRead(body);
        queue.runPending();
        assertThat(trace).containsExactly(
                "error MaxBodyBufferSizeException: Configured max tolerance is 2 bytes.");
        assertThat(body.stream().state()).isEqualTo(ByteStream.State.CLOSED);
    }

    @Test
    void maxBodyBufferSize_knownLength() {
        var cfg = Config.configuration().maxBodyBufferSize(2).build();
        var body = Body.of(ByteStreams.of(new byte[]{1, 2, 3}),
                Source.empty(), OptionalLong.of(3), cfg);
        fullyRead(body);
        queue.runPending();
        assertThat(trace).containsExactly(
                "error MaxBodyBufferSizeException: Configured max tolerance is 2 bytes.");
        assertThat(body.stream().isDisturbed()).isFalse();
    }

    @Test
    void shutDownDestination_callbackDroppedAndLogged() {
        log = LogRecorder.startRecording(DefaultBody.class);
        queue.shutdown();
        fullyRead(Body.of(new byte[]{1}));
        log.assertRemove(WARNING,
                "Body callback dropped, task destination has been shut down.",
                DestinationClosedException.class);
        assertThat(queue.runPending()).isZero();
        assertThat(trace).isEmpty();
    }

    @Test
    void rejectingExecutor_callbackDroppedAndLogged() {
        log = LogRecorder.startRecording(DefaultBody.class);
        ExecutorService dead = Executors.newSingleThreadExecutor();
        dead.shutdown();
        var destination = TaskDestination.serial(dead);

        Body.of(new byte[]{1}).fullyRead(this::onBody, this::onError, destination);
        log.assertRemove(WARNING,
                "Body callback dropped, task destination has been shut down.",
                DestinationClosedException.class)
           .hasCauseExactlyInstanceOf(RejectedExecutionException.class);
        assertThat(destination.isShutdown()).isTrue();
        assertThat(trace).isEmpty();
    }

    @Test
    void shutDownDestination_incrementalReadStops() {
        log = LogRecorder.startRecording(DefaultBody.class);
        queue.shutdown();
        var session = incrementallyRead(ofChunks(new byte[]{1}, new byte[]{2}));
        assertThat(session.isDone()).isTrue();
        log.assertRemove(WARNING, "Body callback dropped", DestinationClosedException.class);
    }

    @Test
    void nullArguments() {
        var body = Body.of(new byte[]{1});
        assertThatThrownBy(() -> body.fullyRead(this::onBody, this::onError, null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> body.incrementallyRead(null, this::onEnd, this::onError, queue))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThat(body.isUnusable()).isFalse();
    }

    @Test
    void negativeLength() {
        assertThatThrownBy(() -> Body.of(ByteStreams.empty(), Source.empty(), OptionalLong.of(-1)))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Negative length: -1");
    }

    @Test
    void blobBody() {
        var cfg = Config.configuration().blobChunkSize(2).build();
        var blob = new Blob(new byte[]{1, 2, 3}, "application/octet-stream");
        var body = Body.of(blob, cfg);
        assertThat(body.source().kind()).isEqualTo(Source.Kind.BLOB);
        assertThat(body.length()).hasValue(3);

        var copy = body.clone();
        incrementallyRead(body);
        fullyRead(copy);
        queue.runPending();
        // The full read used the source, queued before the second chunk
        assertThat(trace).containsExactly("chunk [1, 2]", "body [1, 2, 3]", "chunk [3]", "end");
    }

    @Test
    void toText() {
        var text = Body.of("hëllo".getBytes(UTF_8)).toText(queue).toCompletableFuture();
        assertThat(text).isNotDone();
        queue.runPending();
        assertThat(text.join()).isEqualTo("hëllo");
    }

    @Test
    void toText_malformed() {
        var text = Body.of(new byte[]{(byte) 0xC3}).toText(UTF_8, queue).toCompletableFuture();
        queue.runPending();
        assertThatThrownBy(text::join)
                .isExactlyInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(CharacterCodingException.class);
    }

    @Test
    void toBytes_failure() {
        var boom = new IOException("boom");
        var bytes = Body.of(ByteStreams.failed(boom)).toBytes(queue).toCompletableFuture();
        queue.runPending();
        assertThatThrownBy(bytes::join)
                .isExactlyInstanceOf(CompletionException.class)
                .hasCause(boom);
    }

    /**
     * Returns a stream yielding {@code n} single-byte chunks 1..n, then
     * erroring with the given reason.
     */
    private static ByteStream failingAfter(int n, Throwable reason) {
        var pulls = new AtomicInteger();
        return ByteStreams.create(new ByteStream.UnderlyingSource() {
            @Override
            public void pull(ByteStream.Controller c) {
                int i = pulls.incrementAndGet();
                if (i <= n) {
                    c.enqueue(ByteBuffer.wrap(new byte[]{(byte) i}));
                } else {
                    c.error(reason);
                }
            }
        });
    }
}
