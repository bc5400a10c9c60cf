package alpha.nomagicbody;

import alpha.nomagicbody.util.AbstractImmutableBuilder;

import java.util.function.Consumer;

/**
 * Default implementation of {@link Config}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultConfig implements Config
{
    private final Builder builder;
    private final int     maxBodyBufferSize,
                          blobChunkSize;

    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder           = b;
        maxBodyBufferSize = s.maxBodyBufferSize;
        blobChunkSize     = s.blobChunkSize;
    }

    @Override
    public int maxBodyBufferSize() {
        return maxBodyBufferSize;
    }

    @Override
    public int blobChunkSize() {
        return blobChunkSize;
    }

    @Override
    public Builder toBuilder() {
        return builder;
    }

    @Override
    public String toString() {
        return "DefaultConfig{maxBodyBufferSize=" + maxBodyBufferSize +
               ", blobChunkSize=" + blobChunkSize + "}";
    }

    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();

        static class MutableState {
            int maxBodyBufferSize = 20_971_520,
                blobChunkSize     = 65_536;
        }

        private DefaultBuilder() {
            // super()
        }

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }

        @Override
        public Builder maxBodyBufferSize(int newVal) {
            if (newVal < 0) {
                throw new IllegalArgumentException("Negative: " + newVal);
            }
            return new DefaultBuilder(this, s -> s.maxBodyBufferSize = newVal);
        }

        @Override
        public Builder blobChunkSize(int newVal) {
            if (newVal < 1) {
                throw new IllegalArgumentException("Less than 1: " + newVal);
            }
            return new DefaultBuilder(this, s -> s.blobChunkSize = newVal);
        }

        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
