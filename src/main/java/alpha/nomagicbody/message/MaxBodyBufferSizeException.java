package alpha.nomagicbody.message;

import alpha.nomagicbody.Config;

import java.io.Serial;

/**
 * Thrown if a full body read would accumulate more bytes than the configured
 * maximum.
 *
 * @see Config#maxBodyBufferSize()
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class MaxBodyBufferSizeException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Constructs a {@code MaxBodyBufferSizeException}.
     *
     * @param configuredMax the exceeded tolerance
     */
    public MaxBodyBufferSizeException(int configuredMax) {
        // This would be the first thing one reading the log would like to know
        super("Configured max tolerance is " + configuredMax + " bytes.");
    }
}
