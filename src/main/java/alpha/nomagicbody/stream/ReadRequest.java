package alpha.nomagicbody.stream;

/**
 * Receives the outcome of one {@link ByteStream.Reader#read(ReadRequest)}.<p>
 *
 * Exactly one event is delivered per read call: a chunk, the end or an error.
 * After a terminal event, the request is never invoked again for the same
 * stream. To receive the next chunk, the request (or its owner) must issue a
 * new read.<p>
 *
 * The event is delivered on the stream driver's call stack, which may be the
 * producer's thread, or the thread calling {@code read} if an item was
 * already queued. Implementations should hand the event over to wherever it
 * is processed rather than doing substantial work in place.<p>
 *
 * If the request throws, the exception is logged and otherwise ignored by the
 * stream.
 */
@FunctionalInterface
public interface ReadRequest
{
    /**
     * Called by the stream reader.
     *
     * @param event never {@code null}
     */
    void onEvent(ReadEvent event);
}
