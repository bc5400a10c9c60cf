package alpha.nomagicbody.util;

import java.nio.ByteBuffer;

/**
 * {@code ByteBuffer} utils.
 */
public final class ByteBuffers
{
    private ByteBuffers() {
        // Empty
    }

    /** An empty array. */
    public static final byte[] EMPTY_BYTEARRAY = new byte[0];

    /**
     * Copies the remaining bytes of the given buffer into a new array.<p>
     *
     * The buffer's position is not modified. The returned array is never
     * shared with the buffer, so the producer of the buffer is free to reuse
     * or invalidate it as soon as this method returns.
     *
     * @param buf to copy from
     * @return a new {@code byte[]}
     *
     * @throws NullPointerException if {@code buf} is {@code null}
     */
    public static byte[] copy(ByteBuffer buf) {
        if (!buf.hasRemaining()) {
            return EMPTY_BYTEARRAY;
        }
        var arr = new byte[buf.remaining()];
        buf.get(buf.position(), arr);
        return arr;
    }

    /**
     * Returns a buffer that wraps a copy of the given bytes.
     *
     * @param bytes to copy
     * @return a new buffer
     *
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public static ByteBuffer wrapCopy(byte[] bytes) {
        return ByteBuffer.wrap(bytes.clone());
    }
}
