package org.abstractica.chat.impl.credentials;

import org.abstractica.chat.CredentialStore;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Credential store that keeps values for the lifetime of the process.
 */
public class InMemoryCredentialStore implements CredentialStore
{
    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key)
    {
        Objects.requireNonNull(key, "key");
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void put(String key, String value)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        values.put(key, value);
    }

    @Override
    public void remove(String key)
    {
        Objects.requireNonNull(key, "key");
        values.remove(key);
    }
}
