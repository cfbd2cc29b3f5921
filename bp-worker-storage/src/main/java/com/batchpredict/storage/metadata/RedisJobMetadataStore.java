package com.batchpredict.storage.metadata;

import com.batchpredict.config.PredictConfig;
import com.batchpredict.model.JobMetadata;
import com.batchpredict.model.ResumptionHandle;
import com.batchpredict.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Redis-backed {@link JobMetadataStore}. Values are JSON under
 * {@code <prefix>:batch-transform:<jobName>:metadata}; each entry expires with its resumption handle,
 * since nothing can resume the workflow after that.
 */
public final class RedisJobMetadataStore implements JobMetadataStore {

    private static final Logger log = LoggerFactory.getLogger(RedisJobMetadataStore.class);

    private final JedisPool pool;
    private final PredictConfig config;

    public RedisJobMetadataStore(PredictConfig config) {
        this(config, new JedisPoolConfig());
    }

    public RedisJobMetadataStore(PredictConfig config, JedisPoolConfig poolConfig) {
        this.config = Objects.requireNonNull(config, "config");
        this.pool = new JedisPool(poolConfig, config.getCacheHost(), config.getCachePort());
    }

    @Override
    public void put(JobMetadata metadata) {
        String key = config.getJobMetadataKey(metadata.getJobName());
        long ttl = ttlSeconds(metadata.getResumption(), System.currentTimeMillis());
        try (var jedis = pool.getResource()) {
            if (ttl > 0) {
                jedis.setex(key, ttl, metadata.toJson());
            } else {
                jedis.set(key, metadata.toJson());
            }
            log.info("Job metadata stored | key={} ttlSeconds={}", key, ttl);
        } catch (JedisException e) {
            throw new StorageException("Failed to store job metadata at " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<JobMetadata> get(String jobName) {
        String key = config.getJobMetadataKey(jobName);
        String json;
        try (var jedis = pool.getResource()) {
            json = jedis.get(key);
        } catch (JedisException e) {
            throw new StorageException("Failed to read job metadata at " + key + ": " + e.getMessage(), e);
        }
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(JobMetadata.fromJson(json));
        } catch (UncheckedIOException e) {
            throw new StorageException("Corrupt job metadata at " + key, e);
        }
    }

    @Override
    public void delete(String jobName) {
        String key = config.getJobMetadataKey(jobName);
        try (var jedis = pool.getResource()) {
            jedis.del(key);
            log.info("Job metadata deleted | key={}", key);
        } catch (JedisException e) {
            throw new StorageException("Failed to delete job metadata at " + key + ": " + e.getMessage(), e);
        }
    }

    /**
     * Seconds until the handle expires, at least 1 for a handle that has a deadline; 0 means store without
     * expiry.
     */
    static long ttlSeconds(ResumptionHandle handle, long nowMillis) {
        if (handle == null || handle.getExpiresAtMillis() <= 0) {
            return 0L;
        }
        long remainingMillis = handle.getExpiresAtMillis() - nowMillis;
        return Math.max(1L, (remainingMillis + 999L) / 1000L);
    }
}
