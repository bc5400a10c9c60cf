package alpha.nomagicbody.task;

import java.io.Serial;

/**
 * Thrown by {@link TaskDestination#enqueue(Runnable)} if the destination has
 * been shut down.
 */
public class DestinationClosedException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Constructs this object.
     */
    public DestinationClosedException() {
        super("Task destination has been shut down.");
    }

    /**
     * Constructs this object.
     *
     * @param cause why the destination was shut down
     */
    public DestinationClosedException(Throwable cause) {
        super("Task destination has been shut down.", cause);
    }
}
