package org.abstractica.chat;

/**
 * Thrown when an outbound frame cannot be encoded.
 */
public class FrameEncodingException extends ChatConnectionException
{
    public FrameEncodingException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
