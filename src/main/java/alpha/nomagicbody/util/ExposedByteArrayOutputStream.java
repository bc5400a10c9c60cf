package alpha.nomagicbody.util;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * An unsynchronized view of {@code ByteArrayOutputStream}'s internal
 * {@code byte[]} and {@code count} fields, used as the accumulator of a full
 * body read.<p>
 *
 * Bytes can be appended directly from a {@code ByteBuffer}, without an
 * intermediate array when the buffer is array-backed. The final product is
 * taken exactly once, using {@link #take()}, which returns an array of the
 * exact size and releases the internal buffer.<p>
 *
 * This class is not thread-safe; the owner must ensure appends happen
 * serially.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ExposedByteArrayOutputStream extends ByteArrayOutputStream
{
    /**
     * Constructs this instance.
     *
     * @param size the initial size
     */
    public ExposedByteArrayOutputStream(int size) {
        super(size);
    }

    /**
     * Returns the number of valid bytes in the buffer.
     *
     * @return the number of valid bytes in the buffer
     */
    public int count() {
        return super.count;
    }

    /**
     * Appends all remaining bytes of the given buffer.<p>
     *
     * The buffer's position is not modified.
     *
     * @param buf source
     *
     * @throws IllegalStateException if the product has already been taken
     */
    public void write(ByteBuffer buf) {
        if (super.buf == null) {
            throw new IllegalStateException("Product already taken.");
        }
        final int len = buf.remaining();
        if (len == 0) {
            return;
        }
        if (buf.hasArray()) {
            write(buf.array(), buf.arrayOffset() + buf.position(), len);
        } else {
            var tmp = new byte[len];
            buf.get(buf.position(), tmp);
            write(tmp, 0, len);
        }
    }

    /**
     * Returns the accumulated bytes, then releases the internal buffer.
     *
     * @return an array of exactly {@link #count()} bytes
     *
     * @throws IllegalStateException if the product has already been taken
     */
    public byte[] take() {
        if (super.buf == null) {
            throw new IllegalStateException("Product already taken.");
        }
        try {
            return super.buf.length == super.count ?
                    super.buf : Arrays.copyOf(super.buf, super.count);
        } finally {
            super.buf = null;
        }
    }

    @Override
    public byte[] toByteArray() {
        throw new UnsupportedOperationException();
    }
}
