package org.abstractica.chat;

/**
 * Thrown when a frame is sent while the session is not authenticated.
 */
public class NotConnectedException extends ChatConnectionException
{
    public NotConnectedException()
    {
        super("Chat connection is not connected");
    }
}
