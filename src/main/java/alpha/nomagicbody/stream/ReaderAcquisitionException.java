package alpha.nomagicbody.stream;

import java.io.Serial;

/**
 * Thrown by {@link ByteStream#getReader()} if the stream is locked to another
 * reader, or has already been consumed or cancelled.<p>
 *
 * Being closed or errored is not by itself a reason to fail. A stream that
 * was created closed or errored, and has never been read nor cancelled, can
 * still be acquired; for example {@link ByteStreams#empty()} and {@link
 * ByteStreams#failed(Throwable)}. Only a stream that is both disturbed and not
 * {@link ByteStream.State#READABLE} is refused.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class ReaderAcquisitionException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Constructs this object.
     *
     * @param message detail message
     */
    public ReaderAcquisitionException(String message) {
        super(message);
    }
}
