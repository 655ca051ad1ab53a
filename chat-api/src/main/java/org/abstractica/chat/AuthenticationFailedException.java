package org.abstractica.chat;

/**
 * Thrown by {@link ChatConnection#connect(String)} when the authentication
 * handshake is rejected or is not acknowledged within the timeout.
 */
public class AuthenticationFailedException extends ChatConnectionException
{
    public AuthenticationFailedException(String message)
    {
        super(message);
    }
}
