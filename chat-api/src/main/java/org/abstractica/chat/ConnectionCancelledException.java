package org.abstractica.chat;

/**
 * Thrown to a caller blocked in {@link ChatConnection#connect(String)} when
 * the attempt is abandoned by {@link ChatConnection#disconnect()} or
 * {@link ChatConnection#close()}.
 *
 * <p>Says nothing about the credential.</p>
 */
public class ConnectionCancelledException extends ChatConnectionException
{
    public ConnectionCancelledException(String message)
    {
        super(message);
    }
}
