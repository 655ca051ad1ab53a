package org.abstractica.chat;

import java.util.Optional;

/**
 * Durable key-value storage for credentials.
 *
 * <p>Implementations must survive process restarts if silent session resume
 * is expected to work.</p>
 */
public interface CredentialStore
{
    /**
     * Reads a value.
     *
     * @param key the key
     * @return the stored value, or empty if absent
     */
    Optional<String> get(String key);

    /**
     * Stores a value, replacing any previous value.
     *
     * @param key   the key
     * @param value the value
     */
    void put(String key, String value);

    /**
     * Removes a value. Removing an absent key is a no-op.
     *
     * @param key the key
     */
    void remove(String key);
}
