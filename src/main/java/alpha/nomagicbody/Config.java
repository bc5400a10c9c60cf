package alpha.nomagicbody;

import alpha.nomagicbody.message.Blob;
import alpha.nomagicbody.message.Body;
import alpha.nomagicbody.message.MaxBodyBufferSizeException;

/**
 * Body configuration.<p>
 *
 * {@link Config#toBuilder()} allows for any configuration object to be used
 * as a template for a new instance. The static method {@link
 * #configuration()} is a shortcut for {@code Config.DEFAULT.toBuilder()}:
 *
 * <pre>{@code
 *   Config small = configuration()
 *           .maxBodyBufferSize(1_024)
 *           .build();
 *   Body b = Body.of(stream, Source.empty(), OptionalLong.empty(), small);
 * }</pre>
 *
 * @implSpec
 * The implementation is immutable.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Config
{
    /**
     * The configuration used by bodies created without an explicit
     * configuration.<p>
     *
     * Max body buffer size = 20 971 520 (20 MB)<br>
     * Blob chunk size = 65 536
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();

    /**
     * {@return the max number of bytes that a full read may accumulate}<p>
     *
     * If the body's length is known in advance and larger than this value, or
     * if the limit is exceeded while reading, the full read fails with a
     * {@link MaxBodyBufferSizeException}.<p>
     *
     * This configuration applies to {@link Body#fullyRead} and the methods
     * built on top of it. An incremental read has no limit.
     */
    int maxBodyBufferSize();

    /**
     * {@return the max number of bytes in each chunk of a blob stream}
     *
     * @see Blob#stream(int)
     */
    int blobChunkSize();

    /**
     * {@return a builder initialized with the values of this configuration}
     */
    Config.Builder toBuilder();

    /**
     * {@return a builder initialized with the values of {@link #DEFAULT}}
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }

    /**
     * Builder of a {@link Config}.<p>
     *
     * The builder is immutable; each setter returns a new builder.
     */
    interface Builder {
        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         *
         * @throws IllegalArgumentException if {@code newVal} is negative
         * @see Config#maxBodyBufferSize()
         */
        Builder maxBodyBufferSize(int newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         *
         * @throws IllegalArgumentException if {@code newVal} is less than 1
         * @see Config#blobChunkSize()
         */
        Builder blobChunkSize(int newVal);

        /**
         * Builds the configuration.
         *
         * @return a configuration
         */
        Config build();
    }
}
