package alpha.nomagicbody.stream;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static alpha.nomagicbody.stream.ReadEvent.Kind.CHUNK;
import static alpha.nomagicbody.stream.ReadEvent.Kind.END;
import static alpha.nomagicbody.testutil.Reads.bytes;
import static alpha.nomagicbody.testutil.Reads.concat;
import static alpha.nomagicbody.testutil.Reads.drain;
import static alpha.nomagicbody.testutil.Reads.readOnce;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link ByteStream#tee()}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class TeeTest
{
    @Test
    void bothBranches_observeAllBytes() {
        var s = ByteStreams.of(ByteBuffer.wrap(new byte[]{1, 2}), ByteBuffer.wrap(new byte[]{3}));
        var b = s.tee();
        assertThat(s.isLocked()).isTrue();

        var first = drain(b.first());
        var second = drain(b.second());
        assertThat(first).extracting(ReadEvent::kind).containsExactly(CHUNK, CHUNK, END);
        assertThat(concat(first)).containsExactly(1, 2, 3);
        assertThat(concat(second)).containsExactly(1, 2, 3);
    }

    @Test
    void chunks_areIndependentCopies() {
        var s = ByteStreams.of(new byte[]{7});
        var b = s.tee();
        var r1 = b.first().getReader();
        var c1 = (ByteBuffer) readOnce(r1).get(0).value();
        c1.put(0, (byte) 99);
        var r2 = b.second().getReader();
        assertThat(bytes(readOnce(r2).get(0))).containsExactly(7);
    }

    @Test
    void lockedStream_cannotTee() {
        var s = ByteStreams.of(new byte[]{1});
        s.getReader();
        assertThatThrownBy(s::tee)
                .isExactlyInstanceOf(StreamLockedException.class)
                .hasMessage("Stream is locked to a reader.");
    }

    @Test
    void teedStream_cannotBeRead() {
        var s = ByteStreams.of(new byte[]{1});
        s.tee();
        assertThatThrownBy(s::getReader)
                .isExactlyInstanceOf(ReaderAcquisitionException.class);
    }

    @Test
    void error_reachesBothBranches() {
        var boom = new IOException("boom");
        var b = ByteStreams.failed(boom).tee();
        assertThat(drain(b.first())).containsExactly(ReadEvent.error(boom));
        assertThat(drain(b.second())).containsExactly(ReadEvent.error(boom));
    }

    @Test
    void cancelOneBranch_otherContinues() {
        var b = ByteStreams.of(new byte[]{1, 2, 3}).tee();
        b.first().cancel(new CancellationException());
        assertThat(concat(drain(b.second()))).containsExactly(1, 2, 3);
    }

    @Test
    void cancelBothBranches_cancelsSource() {
        var cancelled = new AtomicReference<Throwable>();
        var s = ByteStreams.create(new ByteStream.UnderlyingSource() {
            @Override
            public void cancel(Throwable reason) {
                cancelled.set(reason);
            }
        });
        var b = s.tee();
        var r1 = new CancellationException("one");
        var r2 = new CancellationException("two");
        b.first().cancel(r1);
        assertThat(cancelled.get()).isNull();
        b.second().cancel(r2);
        assertThat(cancelled).hasValue(r2);
    }

    @Test
    void upstreamIsPulledOnDemand() {
        var pulls = new AtomicInteger();
        var s = ByteStreams.create(new ByteStream.UnderlyingSource() {
            @Override
            public void pull(ByteStream.Controller c) {
                if (pulls.incrementAndGet() == 1) {
                    c.enqueue(ByteBuffer.wrap(new byte[]{4}));
                } else {
                    c.close();
                }
            }
        });
        var b = s.tee();
        assertThat(pulls).hasValue(0);
        var first = drain(b.first());
        assertThat(concat(first)).containsExactly(4);
        // Lagging branch buffered what the first branch pulled
        assertThat(concat(drain(b.second()))).containsExactly(4);
        assertThat(pulls).hasValue(2);
    }
}
