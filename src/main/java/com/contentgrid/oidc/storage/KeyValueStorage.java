package com.contentgrid.oidc.storage;

import java.util.Optional;

/**
 * Synchronous key/value store backing the OIDC configuration. Reads and writes of a single key are strongly
 * consistent.
 *
 * @see InMemoryKeyValueStorage
 */
public interface KeyValueStorage {

    Optional<byte[]> get(String key) throws KeyStorageException;

    void put(String key, byte[] value) throws KeyStorageException;

    /**
     * Removes the value stored under {@code key}; removing an absent key is not an error.
     */
    void delete(String key) throws KeyStorageException;
}
