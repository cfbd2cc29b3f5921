package com.batchpredict.worker.support;

import com.batchpredict.storage.StorageException;
import com.batchpredict.storage.object.ObjectStore;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

public final class InMemoryObjectStore implements ObjectStore {

    private final Map<String, String> objects = new ConcurrentSkipListMap<>();
    private volatile boolean failWrites;

    @Override
    public String getBucket() {
        return "test-bucket";
    }

    @Override
    public String readObject(String key) {
        String content = objects.get(key);
        if (content == null) {
            throw new StorageException("No such key: " + key);
        }
        return content;
    }

    @Override
    public void writeObject(String key, String content) {
        if (failWrites) {
            throw new StorageException("Write refused: " + key);
        }
        objects.put(key, content);
    }

    @Override
    public boolean exists(String key) {
        return objects.containsKey(key);
    }

    @Override
    public List<String> listObjects(String prefix, int maxKeys) {
        return objects.keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .limit(maxKeys)
                .collect(Collectors.toList());
    }

    public void failWrites() {
        this.failWrites = true;
    }

    public Map<String, String> snapshot() {
        return new TreeMap<>(objects);
    }

    public List<String> keysUnder(String prefix) {
        return listObjects(prefix, Integer.MAX_VALUE);
    }
}
