package net.spookly.hchecker.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPubSub;
import redis.clients.jedis.Response;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.exceptions.JedisException;

/**
 * {@link CheckerStore} backed by Redis through a Jedis connection pool.
 */
public final class RedisCheckerStore implements CheckerStore {
    private final RedisConnectionPool pool;

    public RedisCheckerStore(RedisConnectionPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public LockAttempt tryLock(String backendUrl, String syncField) {
        return execute("lock " + backendUrl, jedis -> {
            Transaction tx = jedis.multi();
            Response<Long> placeholder = tx.hsetnx(StoreKeys.LOCK_HASH, backendUrl, StoreKeys.LOCK_PLACEHOLDER);
            Response<Boolean> marker = tx.hexists(StoreKeys.LOCK_HASH, syncField);
            if (tx.exec() == null) {
                throw new StoreException("Lock transaction aborted for " + backendUrl);
            }
            return new LockAttempt(placeholder.get() == 1L, Boolean.TRUE.equals(marker.get()));
        });
    }

    @Override
    public StoreResult claimLock(String backendUrl, String syncField, String token) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(backendUrl, token);
        fields.put(syncField, StoreKeys.MARKER_VALUE);
        return write("claim " + backendUrl, jedis -> {
            jedis.hset(StoreKeys.LOCK_HASH, fields);
            return null;
        });
    }

    @Override
    public String lockValue(String backendUrl) {
        return execute("read lock " + backendUrl, jedis -> jedis.hget(StoreKeys.LOCK_HASH, backendUrl));
    }

    @Override
    public void releaseLock(String backendUrl, String syncField) {
        execute("release " + backendUrl, jedis -> jedis.hdel(StoreKeys.LOCK_HASH, backendUrl, syncField));
    }

    @Override
    public String authoritativeBackend(String frontendKey, long index) {
        return execute("read frontend " + frontendKey,
                jedis -> jedis.lindex(StoreKeys.frontendList(frontendKey), index));
    }

    @Override
    public StoreResult markDead(Map<String, Integer> positions, int ttlSeconds) {
        if (positions.isEmpty()) {
            return StoreResult.ok();
        }
        return write("mark dead", jedis -> {
            Transaction tx = jedis.multi();
            for (Map.Entry<String, Integer> entry : positions.entrySet()) {
                String deadKey = StoreKeys.deadSet(entry.getKey());
                tx.sadd(deadKey, String.valueOf(entry.getValue()));
                tx.expire(deadKey, ttlSeconds);
            }
            return tx.exec();
        });
    }

    @Override
    public StoreResult markAlive(Map<String, Integer> positions) {
        if (positions.isEmpty()) {
            return StoreResult.ok();
        }
        return write("mark alive", jedis -> {
            Transaction tx = jedis.multi();
            for (Map.Entry<String, Integer> entry : positions.entrySet()) {
                tx.srem(StoreKeys.deadSet(entry.getKey()), String.valueOf(entry.getValue()));
            }
            return tx.exec();
        });
    }

    @Override
    public void recordHeartbeat(long epochSeconds) {
        execute("heartbeat", jedis -> jedis.set(StoreKeys.HEARTBEAT, Long.toString(epochSeconds)));
    }

    @Override
    public void clearLocks() {
        execute("clear locks", jedis -> jedis.del(StoreKeys.LOCK_HASH));
    }

    @Override
    public ChannelSubscription openSubscription(String channel) {
        return new RedisChannelSubscription(channel, pool.acquire());
    }

    @Override
    public void close() {
        pool.close();
    }

    private <T> T execute(String description, Function<Jedis, T> command) {
        try (Jedis jedis = pool.acquire()) {
            return command.apply(jedis);
        } catch (JedisException e) {
            throw new StoreException("Store command failed: " + description, e);
        }
    }

    private StoreResult write(String description, Function<Jedis, List<Object>> command) {
        List<Object> replies;
        try {
            replies = execute(description, command);
        } catch (StoreException e) {
            return StoreResult.failed(e);
        }
        if (replies == null) {
            return StoreResult.ok();
        }
        for (Object reply : replies) {
            if (reply instanceof Exception) {
                return StoreResult.failed(new StoreException(
                        "Store command failed: " + description, (Exception) reply));
            }
        }
        return StoreResult.ok();
    }

    private static final class RedisChannelSubscription implements ChannelSubscription {
        private final String channel;
        private final Jedis jedis;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final AtomicBoolean released = new AtomicBoolean(false);
        private volatile Forwarder forwarder;

        private RedisChannelSubscription(String channel, Jedis jedis) {
            this.channel = channel;
            this.jedis = jedis;
        }

        @Override
        public void run(Consumer<String> handler) {
            Forwarder current = new Forwarder(handler);
            forwarder = current;
            try {
                if (closed.get()) {
                    return;
                }
                jedis.subscribe(current, channel);
            } catch (JedisException e) {
                if (!closed.get()) {
                    throw new StoreException("Subscription to " + channel + " failed", e);
                }
            } finally {
                release();
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true) || released.get()) {
                // The connection is already back in the pool.
                return;
            }
            Forwarder current = forwarder;
            if (current == null) {
                release();
                return;
            }
            if (current.isSubscribed()) {
                try {
                    current.unsubscribe();
                    return;
                } catch (JedisException e) {
                    System.err.println("Failed to unsubscribe from " + channel + ": " + e.getMessage());
                }
            }
            // Not yet subscribed or unsubscribe failed: drop the socket so subscribe() unblocks.
            jedis.disconnect();
        }

        private void release() {
            if (released.compareAndSet(false, true)) {
                jedis.close();
            }
        }
    }

    private static final class Forwarder extends JedisPubSub {
        private final Consumer<String> handler;

        private Forwarder(Consumer<String> handler) {
            this.handler = handler;
        }

        @Override
        public void onMessage(String channel, String message) {
            handler.accept(message);
        }
    }
}
