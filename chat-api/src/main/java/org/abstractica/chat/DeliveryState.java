package org.abstractica.chat;

import java.util.Objects;

/**
 * Local delivery status of an outbound chat message.
 *
 * <p>Never transmitted. Transitions move forward
 * (Sending, Sent, Delivered) except Failed back to Sending on retry.</p>
 */
public sealed interface DeliveryState
{
    /**
     * Returns whether this is a terminal success state.
     *
     * @return true for {@link Delivered}
     */
    default boolean isDelivered()
    {
        return this instanceof Delivered;
    }

    /**
     * Returns whether the message is still awaiting confirmation.
     *
     * @return true for {@link Sending} and {@link Sent}
     */
    default boolean isPending()
    {
        return this instanceof Sending || this instanceof Sent;
    }

    /**
     * Send has been issued but the transport has not accepted the frame yet.
     */
    record Sending() implements DeliveryState {}

    /**
     * Frame was written to the transport; awaiting server confirmation.
     */
    record Sent() implements DeliveryState {}

    /**
     * Server acknowledged or echoed the message.
     */
    record Delivered() implements DeliveryState {}

    /**
     * Send failed. The message stays visible and may be retried.
     *
     * @param cause the failure
     */
    record Failed(Throwable cause) implements DeliveryState
    {
        public Failed
        {
            Objects.requireNonNull(cause, "cause");
        }

        /**
         * Returns the failure reason for display.
         *
         * @return the cause message, or the cause type if it has none
         */
        public String reason()
        {
            String message = cause.getMessage();
            return message != null ? message : cause.getClass().getSimpleName();
        }
    }
}
