package com.batchpredict.storage.metadata;

import com.batchpredict.model.ResumptionHandle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RedisJobMetadataStoreTest {

    @Test
    void ttlSeconds_followsResumptionExpiry() {
        ResumptionHandle handle = ResumptionHandle.of(new byte[] {1}, 10_000L);

        assertEquals(10L, RedisJobMetadataStore.ttlSeconds(handle, 0L));
        assertEquals(1L, RedisJobMetadataStore.ttlSeconds(handle, 9_500L));
        assertEquals(1L, RedisJobMetadataStore.ttlSeconds(handle, 20_000L));
    }

    @Test
    void ttlSeconds_isZeroWithoutDeadline() {
        assertEquals(0L, RedisJobMetadataStore.ttlSeconds(ResumptionHandle.of(new byte[] {1}, 0L), 5L));
        assertEquals(0L, RedisJobMetadataStore.ttlSeconds(null, 5L));
    }
}
