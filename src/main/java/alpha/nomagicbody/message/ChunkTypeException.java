package alpha.nomagicbody.message;

import java.io.Serial;
import java.nio.ByteBuffer;

/**
 * A stream produced a chunk that is not a {@link ByteBuffer}.<p>
 *
 * Delivered to the error callback of a body read; the read ends.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ChunkTypeException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code ChunkTypeException}.
     *
     * @param chunk the offending chunk
     */
    public ChunkTypeException(Object chunk) {
        super("Chunk is not a ByteBuffer: " + chunk.getClass().getName());
    }
}
