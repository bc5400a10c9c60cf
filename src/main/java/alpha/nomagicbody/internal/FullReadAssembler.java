package alpha.nomagicbody.internal;

import alpha.nomagicbody.message.ChunkTypeException;
import alpha.nomagicbody.message.MaxBodyBufferSizeException;
import alpha.nomagicbody.stream.ByteStream;
import alpha.nomagicbody.stream.ReadEvent;
import alpha.nomagicbody.stream.ReadRequest;
import alpha.nomagicbody.task.TaskDestination;
import alpha.nomagicbody.util.ExposedByteArrayOutputStream;

import java.nio.ByteBuffer;
import java.util.function.Consumer;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * A read request that collects all chunks of a stream into an expanding
 * {@code byte[]}.<p>
 *
 * The assembler issues one read at a time and re-arms itself from within the
 * stream's delivery of the previous event. When the stream ends, the
 * accumulated bytes are handed to the body callback; if the stream fails, the
 * bytes are discarded and the failure is handed to the error callback. Either
 * way, exactly one callback is queued on the task destination.<p>
 *
 * Accumulating more bytes than the configured max cancels the reader and fails
 * the read with a {@link MaxBodyBufferSizeException}. A chunk that is not a
 * {@code ByteBuffer} cancels the reader and fails the read with a {@link
 * ChunkTypeException}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class FullReadAssembler implements ReadRequest
{
    private static final System.Logger LOG
            = System.getLogger(FullReadAssembler.class.getPackageName());

    private final ByteStream.Reader reader;
    private final int maxBytes;
    private final Consumer<byte[]> processBody;
    private final Consumer<Throwable> processError;
    private final TaskDestination destination;
    private final ExposedByteArrayOutputStream sink;
    // Only accessed by the stream's driver
    private boolean done;

    FullReadAssembler(
            ByteStream.Reader reader,
            int maxBytes,
            Consumer<byte[]> processBody,
            Consumer<Throwable> processError,
            TaskDestination destination)
    {
        this.reader       = reader;
        this.maxBytes     = maxBytes;
        this.processBody  = processBody;
        this.processError = processError;
        this.destination  = destination;
        this.sink         = new ExposedByteArrayOutputStream(128);
        this.done         = false;
    }

    /**
     * Issues the first read.
     */
    void start() {
        reader.read(this);
    }

    @Override
    public void onEvent(ReadEvent event) {
        if (done) {
            LOG.log(DEBUG, () -> "Received " + event.kind() + " although I'm done.");
            return;
        }
        switch (event.kind()) {
            case CHUNK -> onChunk(event.value());
            case END   -> onEnd();
            case ERROR -> fail(event.reason());
        }
    }

    private void onChunk(Object chunk) {
        if (!(chunk instanceof ByteBuffer buf)) {
            abort(new ChunkTypeException(chunk));
            return;
        }
        if ((long) sink.count() + buf.remaining() > maxBytes) {
            abort(new MaxBodyBufferSizeException(maxBytes));
            return;
        }
        sink.write(buf);
        reader.read(this);
    }

    private void onEnd() {
        done = true;
        final byte[] bytes = sink.take();
        DefaultBody.enqueue(destination, () -> processBody.accept(bytes));
    }

    private void abort(Throwable reason) {
        // Producer may have more to give, stop it
        reader.cancel(reason);
        fail(reason);
    }

    private void fail(Throwable reason) {
        done = true;
        sink.take();
        DefaultBody.enqueue(destination, () -> processError.accept(reason));
    }
}
