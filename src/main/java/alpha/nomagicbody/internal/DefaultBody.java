package alpha.nomagicbody.internal;

import alpha.nomagicbody.Config;
import alpha.nomagicbody.message.Body;
import alpha.nomagicbody.message.MaxBodyBufferSizeException;
import alpha.nomagicbody.message.Source;
import alpha.nomagicbody.stream.ByteStream;
import alpha.nomagicbody.stream.ReaderAcquisitionException;
import alpha.nomagicbody.task.DestinationClosedException;
import alpha.nomagicbody.task.TaskDestination;

import java.util.OptionalLong;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Body}.<p>
 *
 * The full read is delegated to a {@link FullReadAssembler} and the
 * incremental read to an {@link IncrementalReadLoop}. A callback that can not
 * be queued because the destination has been shut down is logged and dropped.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class DefaultBody implements Body
{
    private static final System.Logger LOG
            = System.getLogger(DefaultBody.class.getPackageName());

    private volatile ByteStream stream;
    private final Source source;
    private final OptionalLong length;
    private final Config config;

    /**
     * Constructs a {@code DefaultBody}.
     *
     * @param stream content
     * @param source pre-materialized content
     * @param length byte count, if known
     * @param config configuration
     *
     * @throws NullPointerException if any arg is {@code null}
     * @throws IllegalArgumentException if {@code length} is negative
     */
    public DefaultBody(ByteStream stream, Source source, OptionalLong length, Config config) {
        this.stream = requireNonNull(stream);
        this.source = requireNonNull(source);
        this.length = requireNonNull(length);
        this.config = requireNonNull(config);
        if (length.isPresent() && length.getAsLong() < 0) {
            throw new IllegalArgumentException("Negative length: " + length.getAsLong());
        }
    }

    @Override
    public ByteStream stream() {
        return stream;
    }

    @Override
    public Source source() {
        return source;
    }

    @Override
    public OptionalLong length() {
        return length;
    }

    @Override
    public boolean isUnusable() {
        final var s = stream;
        return s.isDisturbed() || s.isLocked();
    }

    @Override
    public void fullyRead(
            Consumer<byte[]> processBody,
            Consumer<Throwable> processError,
            TaskDestination destination)
    {
        requireNonNull(processBody);
        requireNonNull(processError);
        requireNonNull(destination);

        var materialized = source.bytes();
        final int max = config.maxBodyBufferSize();
        if (materialized.isEmpty() && length.isPresent() && length.getAsLong() > max) {
            var e = new MaxBodyBufferSizeException(max);
            enqueue(destination, () -> processError.accept(e));
            return;
        }

        final ByteStream.Reader r;
        try {
            r = stream.getReader();
        } catch (ReaderAcquisitionException e) {
            enqueue(destination, () -> processError.accept(e));
            return;
        }

        if (materialized.isPresent()) {
            // The lock is never released; the body is consumed
            r.cancel(new CancellationException("Body consumed from source."));
            final byte[] bytes = materialized.get();
            enqueue(destination, () -> processBody.accept(bytes));
            return;
        }
        new FullReadAssembler(r, max, processBody, processError, destination).start();
    }

    @Override
    public ReadSession incrementallyRead(
            Consumer<byte[]> processChunk,
            Runnable processEnd,
            Consumer<Throwable> processError,
            TaskDestination destination)
    {
        requireNonNull(processChunk);
        requireNonNull(processEnd);
        requireNonNull(processError);
        requireNonNull(destination);
        var loop = new IncrementalReadLoop(
                stream.getReader(), processChunk, processEnd, processError, destination);
        loop.start();
        return loop;
    }

    @Override
    public Body clone() {
        // Throws StreamLockedException before anything is mutated
        var branches = stream.tee();
        stream = branches.first();
        LOG.log(DEBUG, "Body cloned.");
        return new DefaultBody(branches.second(), source, length, config);
    }

    @Override
    public String toString() {
        return DefaultBody.class.getSimpleName() + "{" +
                "source=" + source +
                ", length=" + length +
                ", stream=" + stream.state() + "}";
    }

    /**
     * Queues a task on the destination.<p>
     *
     * If the destination has been shut down, the task is dropped and a
     * warning is logged.
     *
     * @param destination of task
     * @param task to queue
     * @return {@code true} if queued, otherwise {@code false}
     */
    static boolean enqueue(TaskDestination destination, Runnable task) {
        try {
            destination.enqueue(task);
            return true;
        } catch (DestinationClosedException e) {
            LOG.log(WARNING, "Body callback dropped, task destination has been shut down.", e);
            return false;
        }
    }
}
