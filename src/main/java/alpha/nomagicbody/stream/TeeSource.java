package alpha.nomagicbody.stream;

import alpha.nomagicbody.util.ByteBuffers;
import alpha.nomagicbody.util.SerialExecutor;

import java.nio.ByteBuffer;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Feeds the two branches of a teed stream from the reader of the original
 * stream.<p>
 *
 * An upstream read is issued when either branch pulls, unless a read is
 * already in flight, in which case one more read is issued when the current
 * one completes. Each {@code ByteBuffer} chunk is copied so that every branch
 * owns its bytes; other chunks are passed as-is.<p>
 *
 * All logic runs serially on an executor of this class, so upstream events
 * and branch signals never interleave.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class TeeSource
{
    private static final System.Logger LOG
            = System.getLogger(TeeSource.class.getPackageName());

    /**
     * Creates the branches.
     *
     * @param upstream the locked reader of the stream being teed
     * @return the branches
     */
    static ByteStream.Branches split(ByteStream.Reader upstream) {
        var tee = new TeeSource(upstream);
        return new ByteStream.Branches(tee.first.stream, tee.second.stream);
    }

    private final ByteStream.Reader upstream;
    private final SerialExecutor serial;
    private final Branch first, second;
    // Serial-confined
    private boolean reading, readAgain, done;

    private TeeSource(ByteStream.Reader upstream) {
        this.upstream = upstream;
        this.serial   = new SerialExecutor();
        this.first    = new Branch("first");
        this.second   = new Branch("second");
    }

    private void pullUpstream() {
        if (done) {
            return;
        }
        if (reading) {
            readAgain = true;
            return;
        }
        reading = true;
        upstream.read(e -> serial.execute(() -> onUpstream(e)));
    }

    private void onUpstream(ReadEvent e) {
        reading = false;
        switch (e.kind()) {
            case CHUNK -> {
                if (e.value() instanceof ByteBuffer buf) {
                    byte[] copy = ByteBuffers.copy(buf);
                    first.offer(ByteBuffer.wrap(copy));
                    second.offer(ByteBuffer.wrap(copy.clone()));
                } else {
                    first.offer(e.value());
                    second.offer(e.value());
                }
                if (readAgain) {
                    readAgain = false;
                    pullUpstream();
                }
            }
            case END -> {
                done = true;
                first.close();
                second.close();
            }
            case ERROR -> {
                done = true;
                first.error(e.reason());
                second.error(e.reason());
            }
        }
    }

    private void onCancel(Branch b, Throwable reason) {
        b.cancelled = true;
        LOG.log(DEBUG, () -> "Tee's " + b.name + " branch cancelled.");
        if (first.cancelled && second.cancelled && !done) {
            done = true;
            upstream.cancel(reason);
        }
    }

    private final class Branch implements ByteStream.UnderlyingSource {
        final String name;
        final DefaultByteStream stream;
        // Serial-confined
        boolean cancelled;

        Branch(String name) {
            this.name   = name;
            this.stream = new DefaultByteStream(this).start();
        }

        @Override
        public void pull(ByteStream.Controller ignored) {
            serial.execute(TeeSource.this::pullUpstream);
        }

        @Override
        public void cancel(Throwable reason) {
            serial.execute(() -> onCancel(this, reason));
        }

        void offer(Object chunk) {
            if (!cancelled) {
                stream.controller().tryEnqueue(chunk);
            }
        }

        void close() {
            if (!cancelled) {
                stream.controller().tryClose();
            }
        }

        void error(Throwable reason) {
            if (!cancelled) {
                stream.controller().tryError(reason);
            }
        }
    }
}
