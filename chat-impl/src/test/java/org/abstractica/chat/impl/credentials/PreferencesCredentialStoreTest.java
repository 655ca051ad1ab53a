package org.abstractica.chat.impl.credentials;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.UUID;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PreferencesCredentialStore}, using a throwaway preferences node.
 */
class PreferencesCredentialStoreTest
{
    private Preferences node;

    @BeforeEach
    void setUp()
    {
        node = Preferences.userRoot().node("org/abstractica/chat/test-" + UUID.randomUUID());
    }

    @AfterEach
    void tearDown() throws BackingStoreException
    {
        node.removeNode();
    }

    @Test
    void putGetRemove()
    {
        PreferencesCredentialStore store = new PreferencesCredentialStore(node);

        store.put("auth_token", "abc");
        assertEquals(Optional.of("abc"), store.get("auth_token"));

        store.remove("auth_token");
        assertEquals(Optional.empty(), store.get("auth_token"));
    }

    @Test
    void values_areVisibleToOtherStoresOnSameNode()
    {
        new PreferencesCredentialStore(node).put("auth_token", "shared");

        assertEquals(Optional.of("shared"), new PreferencesCredentialStore(node).get("auth_token"));
    }
}
