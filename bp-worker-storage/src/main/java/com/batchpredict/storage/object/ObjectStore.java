package com.batchpredict.storage.object;

import java.util.List;

/**
 * Text objects in a single bucket, addressed by key. All failures surface as
 * {@link com.batchpredict.storage.StorageException}.
 */
public interface ObjectStore {

    String getBucket();

    /** Reads an object as UTF-8 text. Fails if it does not exist. */
    String readObject(String key);

    void writeObject(String key, String content);

    boolean exists(String key);

    /** Up to {@code maxKeys} keys under the prefix, in the store's listing order. */
    List<String> listObjects(String prefix, int maxKeys);

    /** Absolute location of a key, as passed to the prediction service. */
    default String uri(String key) {
        return "s3://" + getBucket() + "/" + key;
    }
}
