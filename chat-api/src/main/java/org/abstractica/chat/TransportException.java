package org.abstractica.chat;

import java.io.IOException;

/**
 * Socket-level failure while opening, reading or writing the transport.
 */
public class TransportException extends ChatConnectionException
{
    public TransportException(String message, IOException cause)
    {
        super(message, cause);
    }

    @Override
    public synchronized IOException getCause()
    {
        return (IOException) super.getCause();
    }
}
