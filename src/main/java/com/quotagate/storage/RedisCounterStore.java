package com.quotagate.storage;

import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Response;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Redis-backed counter store.
 * Handles connection pooling. No retries: every Jedis failure surfaces as
 * StoreUnavailableException on the first attempt.
 */
@Slf4j
public class RedisCounterStore implements CounterStore {

    private final JedisPool jedisPool;

    public RedisCounterStore(String host, int port) {
        this(host, port, 2000, null, 0);
    }

    public RedisCounterStore(String host, int port, int timeoutMillis, String password, int database) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(128);
        poolConfig.setMaxIdle(32);
        poolConfig.setMinIdle(16);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofMillis(timeoutMillis));

        String auth = password == null || password.isBlank() ? null : password;
        this.jedisPool = new JedisPool(poolConfig, host, port, timeoutMillis, auth, database);
        log.info("Redis counter store initialized: {}:{} db={} timeout={}ms",
                host, port, database, timeoutMillis);
    }

    /**
     * Single MGET: one command, so all three counters come from the same instant.
     * A key holding a non-string type reads as nil.
     */
    @Override
    public Map<String, String> batchGet(List<String> keys) {
        try (var jedis = jedisPool.getResource()) {
            List<String> values = jedis.mget(keys.toArray(new String[0]));

            Map<String, String> found = new HashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                String value = values.get(i);
                if (value != null) {
                    found.put(keys.get(i), value);
                }
            }
            return found;
        } catch (JedisException e) {
            log.warn("Counter read failed for {}: {}", keys, e.getMessage());
            throw new StoreUnavailableException("Failed to read counters " + keys, e);
        }
    }

    @Override
    public void batchIncrementAndExpire(List<CounterIncrement> increments) {
        try (var jedis = jedisPool.getResource()) {
            var pipe = jedis.pipelined();
            List<Response<Long>> responses = new ArrayList<>(increments.size() * 2);
            for (CounterIncrement increment : increments) {
                responses.add(pipe.incrBy(increment.getKey(), increment.getDelta()));
                responses.add(pipe.pexpire(increment.getKey(), increment.getTtl().toMillis()));
            }
            pipe.sync();

            // Command errors (e.g. WRONGTYPE) only surface when the response is read
            for (Response<Long> response : responses) {
                response.get();
            }
        } catch (JedisException e) {
            log.warn("Counter increment failed for {}: {}", increments, e.getMessage());
            throw new StoreUnavailableException("Failed to increment counters", e);
        }
    }

    @Override
    public void delete(List<String> keys) {
        try (var jedis = jedisPool.getResource()) {
            jedis.del(keys.toArray(new String[0]));
        } catch (JedisException e) {
            log.warn("Counter delete failed for {}: {}", keys, e.getMessage());
            throw new StoreUnavailableException("Failed to delete counters " + keys, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try (var jedis = jedisPool.getResource()) {
            return "PONG".equals(jedis.ping());
        } catch (Exception e) {
            log.warn("Redis health check failed", e);
            return false;
        }
    }

    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
            log.info("Redis connection pool closed");
        }
    }
}
