package org.abstractica.chat;

/**
 * Base class for failures reported by a {@link ChatConnection}.
 */
public class ChatConnectionException extends Exception
{
    public ChatConnectionException(String message)
    {
        super(message);
    }

    public ChatConnectionException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
