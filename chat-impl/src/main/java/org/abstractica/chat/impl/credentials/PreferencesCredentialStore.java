package org.abstractica.chat.impl.credentials;

import org.abstractica.chat.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Credential store backed by the user's {@link Preferences}.
 *
 * <p>Values survive restarts of the process. Changes are flushed to the
 * backing store immediately; a failed flush is logged and the value stays
 * available in the current process.</p>
 */
public class PreferencesCredentialStore implements CredentialStore
{
    private static final Logger LOG = LoggerFactory.getLogger(PreferencesCredentialStore.class);

    /**
     * Default preferences node below the user root.
     */
    public static final String DEFAULT_NODE = "org/abstractica/chat";

    private final Preferences node;

    public PreferencesCredentialStore()
    {
        this(Preferences.userRoot().node(DEFAULT_NODE));
    }

    public PreferencesCredentialStore(Preferences node)
    {
        this.node = Objects.requireNonNull(node, "node");
    }

    @Override
    public Optional<String> get(String key)
    {
        Objects.requireNonNull(key, "key");
        return Optional.ofNullable(node.get(key, null));
    }

    @Override
    public void put(String key, String value)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        node.put(key, value);
        flush();
    }

    @Override
    public void remove(String key)
    {
        Objects.requireNonNull(key, "key");
        node.remove(key);
        flush();
    }

    private void flush()
    {
        try
        {
            node.flush();
        }
        catch (BackingStoreException e)
        {
            LOG.warn("Failed to persist credentials in {}: {}", node.absolutePath(), e.getMessage());
        }
    }
}
