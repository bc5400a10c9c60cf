package alpha.nomagicbody.stream;

import java.io.Serial;

/**
 * Thrown when an operation requires exclusive access to a stream, but the
 * stream is locked to a reader.<p>
 *
 * For example, {@link ByteStream#tee()} and {@link ByteStream#cancel(Throwable)}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class StreamLockedException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Constructs this object.
     */
    public StreamLockedException() {
        super("Stream is locked to a reader.");
    }
}
