package net.spookly.hchecker.store;

import java.util.function.Consumer;

/**
 * A single subscription to a publish/subscribe channel bound to one store connection.
 */
public interface ChannelSubscription extends AutoCloseable {
    /**
     * Deliver messages to {@code handler} until the subscription is closed.
     *
     * @throws StoreException when the transport fails; the subscription is unusable afterwards
     */
    void run(Consumer<String> handler);

    /**
     * Unsubscribe and release the connection. Makes a running {@link #run} return normally.
     */
    @Override
    void close();
}
