package org.abstractica.chat.impl.client;

import org.abstractica.chat.AuthenticationFailedException;
import org.abstractica.chat.ChatConnection;
import org.abstractica.chat.ChatConnectionException;
import org.abstractica.chat.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Owns the process-wide chat connection and its stored credential.
 *
 * <p>A rejected or unacknowledged token is removed from the store so the
 * next start does not try it again. Transport failures and attempts
 * cancelled by a disconnect keep the token.</p>
 */
public class ChatSessionLifecycle implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(ChatSessionLifecycle.class);

    /**
     * Key under which the bearer token is stored.
     */
    public static final String TOKEN_KEY = "auth_token";

    private final ChatConnection connection;
    private final CredentialStore credentials;

    public ChatSessionLifecycle(ChatConnection connection, CredentialStore credentials)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
    }

    /**
     * Connects with the stored token, if there is one.
     *
     * @return true if a stored token was found and accepted
     * @throws AuthenticationFailedException if the stored token was not accepted; it is removed
     * @throws ChatConnectionException       if the connection could not be established
     * @throws InterruptedException          if interrupted while connecting
     */
    public boolean resume() throws ChatConnectionException, InterruptedException
    {
        Optional<String> token = credentials.get(TOKEN_KEY);
        if (token.isEmpty())
        {
            LOG.debug("No stored token, not resuming");
            return false;
        }

        LOG.info("Resuming session with stored token");
        connectWith(token.get());
        return true;
    }

    /**
     * Stores the token and connects with it.
     *
     * @param token the bearer token
     * @throws AuthenticationFailedException if the token was not accepted; it is removed
     * @throws ChatConnectionException       if the connection could not be established
     * @throws InterruptedException          if interrupted while connecting
     */
    public void login(String token) throws ChatConnectionException, InterruptedException
    {
        Objects.requireNonNull(token, "token");
        credentials.put(TOKEN_KEY, token);
        connectWith(token);
    }

    /**
     * Forgets the stored token and disconnects.
     */
    public void logout()
    {
        credentials.remove(TOKEN_KEY);
        connection.disconnect();
        LOG.info("Logged out");
    }

    public ChatConnection getConnection()
    {
        return connection;
    }

    @Override
    public void close()
    {
        connection.close();
    }

    private void connectWith(String token) throws ChatConnectionException, InterruptedException
    {
        try
        {
            connection.connect(token);
        }
        catch (AuthenticationFailedException e)
        {
            LOG.warn("Stored token removed: {}", e.getMessage());
            credentials.remove(TOKEN_KEY);
            throw e;
        }
    }
}
