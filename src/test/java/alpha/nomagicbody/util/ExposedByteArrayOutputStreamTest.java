package alpha.nomagicbody.util;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link ExposedByteArrayOutputStream}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class ExposedByteArrayOutputStreamTest
{
    @Test
    void write_heapBuffer_positionUnchanged() {
        var sink = new ExposedByteArrayOutputStream(2);
        var buf = ByteBuffer.wrap(new byte[]{0, 1, 2, 3});
        buf.position(1);
        sink.write(buf);
        assertThat(buf.position()).isOne();
        assertThat(sink.count()).isEqualTo(3);
        assertThat(sink.take()).containsExactly(1, 2, 3);
    }

    @Test
    void write_directBuffer() {
        var sink = new ExposedByteArrayOutputStream(8);
        var buf = ByteBuffer.allocateDirect(2).put((byte) 7).put((byte) 8).flip();
        sink.write(buf);
        assertThat(buf.remaining()).isEqualTo(2);
        assertThat(sink.take()).containsExactly(7, 8);
    }

    @Test
    void take_exactSize_thenUnusable() {
        var sink = new ExposedByteArrayOutputStream(128);
        sink.write(ByteBuffer.wrap(new byte[]{9}));
        assertThat(sink.take()).hasSize(1);
        assertThatThrownBy(sink::take)
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Product already taken.");
        assertThatThrownBy(() -> sink.write(ByteBuffer.allocate(1)))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Product already taken.");
    }

    @Test
    void toByteArray_unsupported() {
        assertThatThrownBy(() -> new ExposedByteArrayOutputStream(1).toByteArray())
                .isExactlyInstanceOf(UnsupportedOperationException.class);
    }
}
