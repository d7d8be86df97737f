package net.spookly.hchecker.store;

import java.time.Duration;

import net.spookly.hchecker.config.ConfigDefaults;
import net.spookly.hchecker.config.HcheckerConfig;
import net.spookly.hchecker.util.StoreAddress;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Pooled connections to the coordination store.
 *
 * <p>Idle connections are PINGed before reuse; a connection failing the PING is discarded and a new
 * one is dialed in its place.
 */
public final class RedisConnectionPool implements AutoCloseable {
    private final JedisPool pool;
    private final StoreAddress address;

    RedisConnectionPool(JedisPool pool, StoreAddress address) {
        this.pool = pool;
        this.address = address;
    }

    /**
     * Build a pool from the {@code redis} config section, applying defaults for omitted values.
     */
    public static RedisConnectionPool fromConfig(HcheckerConfig config) {
        HcheckerConfig.RedisConfig redis = config.redis == null ? new HcheckerConfig.RedisConfig() : config.redis;
        StoreAddress address = StoreAddress.parse(redis.address == null ? ConfigDefaults.REDIS_ADDRESS : redis.address);
        int timeoutMs = ConfigDefaults.orDefault(redis.timeoutMs, ConfigDefaults.REDIS_TIMEOUT_MS);
        String password = redis.password == null || redis.password.isBlank() ? null : redis.password;
        JedisPool pool = new JedisPool(poolConfig(redis), address.host(), address.port(), timeoutMs, password);
        return new RedisConnectionPool(pool, address);
    }

    static JedisPoolConfig poolConfig(HcheckerConfig.RedisConfig redis) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxIdle(ConfigDefaults.orDefault(redis.maxIdle, ConfigDefaults.REDIS_MAX_IDLE));
        poolConfig.setMaxTotal(ConfigDefaults.orDefault(redis.maxTotal, ConfigDefaults.REDIS_MAX_TOTAL));
        poolConfig.setMinEvictableIdleTime(Duration.ofSeconds(
                ConfigDefaults.orDefault(redis.idleTimeoutSeconds, ConfigDefaults.REDIS_IDLE_TIMEOUT_SECONDS)));
        poolConfig.setTestOnBorrow(true);
        poolConfig.setBlockWhenExhausted(true);
        return poolConfig;
    }

    /**
     * Borrow a connection. Closing the returned connection hands it back to the pool.
     *
     * @throws StoreException when no connection can be established
     */
    public Jedis acquire() {
        try {
            return pool.getResource();
        } catch (JedisException e) {
            throw new StoreException("Failed to acquire store connection to " + address, e);
        }
    }

    /**
     * Dial and PING once so an unreachable store fails startup.
     *
     * @throws StoreException when the store does not answer
     */
    public void verify() {
        try (Jedis jedis = acquire()) {
            jedis.ping();
        } catch (JedisException e) {
            throw new StoreException("Store did not answer PING at " + address, e);
        }
    }

    public StoreAddress address() {
        return address;
    }

    @Override
    public void close() {
        pool.close();
    }
}
