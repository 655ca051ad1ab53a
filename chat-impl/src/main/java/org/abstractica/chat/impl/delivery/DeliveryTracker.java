package org.abstractica.chat.impl.delivery;

import org.abstractica.chat.ChatConnection;
import org.abstractica.chat.ChatConnectionException;
import org.abstractica.chat.DeliveryState;
import org.abstractica.chat.InboundEvent;
import org.abstractica.chat.LocalUser;
import org.abstractica.chat.Message;
import org.abstractica.chat.OutboundFrame;
import org.abstractica.chat.handlers.EventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Ordered message list of one chat room with optimistic sending.
 *
 * <p>A submitted message is shown immediately as {@code Sending}, becomes
 * {@code Sent} once the frame is written and {@code Delivered} when the
 * server acknowledges or echoes its id. A failed send leaves the message in
 * the list as {@code Failed} so it can be retried with the same id.</p>
 *
 * <p>Inbound messages from other users are appended once per id. Echoes of
 * the local user's messages only update existing entries.</p>
 *
 * <p>Listeners are notified while the list is locked, so every listener sees
 * the changes of a message in the order they were applied.</p>
 */
public class DeliveryTracker implements EventListener
{
    private static final Logger LOG = LoggerFactory.getLogger(DeliveryTracker.class);

    private final ChatConnection connection;
    private final LocalUser localUser;
    private final String roomId;
    private final Executor executor;

    private final Map<String, Message> messages = new LinkedHashMap<>();
    private final List<DeliveryListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Creates an empty tracker.
     *
     * @param connection the connection messages are sent on
     * @param localUser  the user messages are authored by
     * @param roomId     the room this tracker belongs to
     * @param executor   runs the sends, off the caller's thread
     */
    public DeliveryTracker(ChatConnection connection, LocalUser localUser, String roomId, Executor executor)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.localUser = Objects.requireNonNull(localUser, "localUser");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    // ========== Outbound ==========

    /**
     * Adds a message authored by the local user and starts sending it.
     *
     * @param content the message text
     * @return the message in the {@code Sending} state
     * @throws IllegalArgumentException if the content is blank
     */
    public Message submit(String content)
    {
        Objects.requireNonNull(content, "content");
        if (content.isBlank())
        {
            throw new IllegalArgumentException("Message content must not be blank");
        }

        Message message = new Message(
                UUID.randomUUID().toString(),
                localUser.id(),
                localUser.name(),
                content,
                Instant.now(),
                roomId,
                new DeliveryState.Sending());

        synchronized (messages)
        {
            messages.put(message.id(), message);
            notifyListeners(message);
        }

        dispatch(message);
        return message;
    }

    /**
     * Sends a failed message again under the same id.
     *
     * @param messageId the message to retry
     * @return true if the message was failed and is being sent again
     */
    public boolean retry(String messageId)
    {
        Objects.requireNonNull(messageId, "messageId");

        Message retried;
        synchronized (messages)
        {
            Message current = messages.get(messageId);
            if (current == null || !(current.deliveryState() instanceof DeliveryState.Failed))
            {
                return false;
            }
            retried = current.withDeliveryState(new DeliveryState.Sending());
            messages.put(messageId, retried);
            notifyListeners(retried);
        }

        LOG.debug("Retrying message {}", messageId);
        dispatch(retried);
        return true;
    }

    private void dispatch(Message message)
    {
        OutboundFrame frame = new OutboundFrame.ChatMessage(message.id(), message.content(), roomId);
        try
        {
            executor.execute(() -> sendFrame(message.id(), frame));
        }
        catch (RejectedExecutionException e)
        {
            LOG.warn("Send of message {} rejected: {}", message.id(), e.getMessage());
            transition(message.id(), new DeliveryState.Failed(e));
        }
    }

    private void sendFrame(String messageId, OutboundFrame frame)
    {
        try
        {
            connection.send(frame);
            transition(messageId, new DeliveryState.Sent());
        }
        catch (ChatConnectionException e)
        {
            LOG.warn("Failed to send message {}: {}", messageId, e.getMessage());
            transition(messageId, new DeliveryState.Failed(e));
        }
    }

    // ========== Inbound ==========

    @Override
    public void onEvent(InboundEvent event)
    {
        if (event instanceof InboundEvent.MessageAck ack)
        {
            markDelivered(ack.messageId());
        }
        else if (event instanceof InboundEvent.MessageReceived received)
        {
            handleReceived(received.message());
        }
    }

    private void handleReceived(Message message)
    {
        if (!roomId.equals(message.roomId()))
        {
            return;
        }

        if (localUser.id().equals(message.senderId()))
        {
            if (!markDelivered(message.id()))
            {
                LOG.debug("Dropping echo of unknown own message {}", message.id());
            }
            return;
        }

        Message delivered = message.withDeliveryState(new DeliveryState.Delivered());
        synchronized (messages)
        {
            if (messages.containsKey(message.id()))
            {
                LOG.trace("Ignoring duplicate message {}", message.id());
                return;
            }
            messages.put(message.id(), delivered);
            notifyListeners(delivered);
        }
    }

    private boolean markDelivered(String messageId)
    {
        synchronized (messages)
        {
            Message current = messages.get(messageId);
            if (current == null)
            {
                return false;
            }
            if (current.deliveryState().isDelivered())
            {
                return true;
            }
            Message updated = current.withDeliveryState(new DeliveryState.Delivered());
            messages.put(messageId, updated);
            notifyListeners(updated);
            return true;
        }
    }

    private void transition(String messageId, DeliveryState next)
    {
        synchronized (messages)
        {
            Message current = messages.get(messageId);
            // An ack or echo may arrive before the send call returns
            if (current == null || !(current.deliveryState() instanceof DeliveryState.Sending))
            {
                return;
            }
            Message updated = current.withDeliveryState(next);
            messages.put(messageId, updated);
            notifyListeners(updated);
        }
    }

    // ========== History ==========

    /**
     * Replaces the list with previously stored messages.
     *
     * <p>Messages of other rooms are skipped. Entries authored locally that
     * the history does not contain are kept after the history.</p>
     *
     * @param history the stored messages, oldest first
     */
    public void replaceHistory(List<Message> history)
    {
        Objects.requireNonNull(history, "history");

        synchronized (messages)
        {
            Map<String, Message> merged = new LinkedHashMap<>();
            for (Message message : history)
            {
                if (roomId.equals(message.roomId()))
                {
                    merged.put(message.id(), message);
                }
            }
            for (Message message : messages.values())
            {
                if (localUser.id().equals(message.senderId()) && !merged.containsKey(message.id()))
                {
                    merged.put(message.id(), message);
                }
            }
            messages.clear();
            messages.putAll(merged);
        }
        LOG.debug("Loaded {} history messages for room {}", history.size(), roomId);
    }

    // ========== Queries ==========

    /**
     * Returns the messages in display order.
     *
     * @return a snapshot of the message list
     */
    public List<Message> messages()
    {
        synchronized (messages)
        {
            return List.copyOf(messages.values());
        }
    }

    /**
     * Looks up a message by id.
     *
     * @param messageId the message id
     * @return the current version of the message, or empty if unknown
     */
    public Optional<Message> find(String messageId)
    {
        synchronized (messages)
        {
            return Optional.ofNullable(messages.get(messageId));
        }
    }

    public String getRoomId()
    {
        return roomId;
    }

    /**
     * Registers a listener for message changes.
     *
     * <p>Listeners run on the thread that changed the message, while the
     * message list is locked. They must not block on other threads that use
     * this tracker.</p>
     *
     * @param listener the listener
     */
    public void addListener(DeliveryListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener
     */
    public void removeListener(DeliveryListener listener)
    {
        listeners.remove(listener);
    }

    private void notifyListeners(Message message)
    {
        for (DeliveryListener listener : listeners)
        {
            try
            {
                listener.onMessageChanged(message);
            }
            catch (Exception e)
            {
                LOG.error("Delivery listener error", e);
            }
        }
    }
}
