package alpha.nomagicbody.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Baseclass for immutable builders.<p>
 *
 * Each builder links back to the builder it was derived from and stores only a
 * modifying action. At build time, the actions are replayed, oldest first,
 * against a fresh mutable state container.
 *
 * @param <S> mutable state container
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public abstract class AbstractImmutableBuilder<S>
{
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;

    /**
     * Constructs a root builder.
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }

    /**
     * Constructs a builder derived from {@code prev}.
     *
     * @param prev previous builder
     * @param modifier action to apply on mutable state
     *
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractImmutableBuilder(
            AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }

    /**
     * Creates the state container and replays all modifiers against it.
     *
     * @param factory of state
     * @return the populated state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> mods = new ArrayDeque<>();
        for (var b = this; b.modifier != null; b = b.prev) {
            mods.addFirst(b.modifier);
        }
        S s = factory.get();
        mods.forEach(m -> m.accept(s));
        return s;
    }
}
