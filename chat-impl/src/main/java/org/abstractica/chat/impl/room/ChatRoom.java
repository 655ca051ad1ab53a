package org.abstractica.chat.impl.room;

import org.abstractica.chat.ChatConnection;
import org.abstractica.chat.ChatConnectionException;
import org.abstractica.chat.InboundEvent;
import org.abstractica.chat.LocalUser;
import org.abstractica.chat.Message;
import org.abstractica.chat.MessageHistory;
import org.abstractica.chat.OutboundFrame;
import org.abstractica.chat.Subscription;
import org.abstractica.chat.impl.delivery.DeliveryListener;
import org.abstractica.chat.impl.delivery.DeliveryTracker;
import org.abstractica.chat.impl.scheduling.TaskScheduler;
import org.abstractica.chat.impl.typing.TypingDebouncer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * A chat room view over a shared connection.
 *
 * <p>Holds the room's message list, the compose buffer, the users currently
 * typing in the room and the users known to be online. Typing indicators and
 * message sends run on the supplied executor.</p>
 *
 * <pre>{@code
 * ChatRoom room = new ChatRoom(connection, user, "general", scheduler, executor);
 * room.loadHistory(history);
 * room.setComposeText("hello");
 * room.sendMessage();
 * }</pre>
 */
public class ChatRoom implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(ChatRoom.class);

    private final ChatConnection connection;
    private final LocalUser localUser;
    private final String roomId;
    private final Executor executor;

    private final DeliveryTracker tracker;
    private final TypingDebouncer debouncer;
    private final Subscription subscription;

    private final Set<String> typingUsers = ConcurrentHashMap.newKeySet();
    private final Set<String> onlineUsers = ConcurrentHashMap.newKeySet();
    private String composeText = "";

    public ChatRoom(
            ChatConnection connection,
            LocalUser localUser,
            String roomId,
            TaskScheduler scheduler,
            Executor executor
    )
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.localUser = Objects.requireNonNull(localUser, "localUser");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.executor = Objects.requireNonNull(executor, "executor");

        this.tracker = new DeliveryTracker(connection, localUser, roomId, executor);
        this.debouncer = new TypingDebouncer(scheduler, this::sendTyping);
        this.subscription = connection.subscribe(this::onEvent);
    }

    // ========== Compose ==========

    /**
     * Replaces the compose buffer and updates the typing indicator.
     *
     * @param text the new buffer content
     */
    public void setComposeText(String text)
    {
        Objects.requireNonNull(text, "text");
        synchronized (this)
        {
            composeText = text;
        }
        debouncer.onTextChanged(text);
    }

    public synchronized String getComposeText()
    {
        return composeText;
    }

    /**
     * Sends the compose buffer as a message and clears it.
     *
     * @return the submitted message, or empty if the buffer was blank
     */
    public Optional<Message> sendMessage()
    {
        String text;
        synchronized (this)
        {
            text = composeText.trim();
            if (text.isEmpty())
            {
                return Optional.empty();
            }
            composeText = "";
        }

        debouncer.stop();
        return Optional.of(tracker.submit(text));
    }

    /**
     * Sends a failed message again.
     *
     * @param messageId the failed message
     * @return true if a send was started
     */
    public boolean retry(String messageId)
    {
        return tracker.retry(messageId);
    }

    // ========== History ==========

    /**
     * Loads earlier messages of this room.
     *
     * @param history source of stored messages
     * @throws IOException if the history cannot be fetched
     */
    public void loadHistory(MessageHistory history) throws IOException
    {
        Objects.requireNonNull(history, "history");
        List<Message> loaded = history.fetchMessages(roomId);
        tracker.replaceHistory(loaded);
    }

    // ========== Events ==========

    private void onEvent(InboundEvent event)
    {
        tracker.onEvent(event);

        if (event instanceof InboundEvent.UserTyping typingEvent)
        {
            if (!roomId.equals(typingEvent.roomId()) || localUser.id().equals(typingEvent.userId()))
            {
                return;
            }
            if (typingEvent.isTyping())
            {
                typingUsers.add(typingEvent.userId());
            }
            else
            {
                typingUsers.remove(typingEvent.userId());
            }
        }
        else if (event instanceof InboundEvent.PresenceChanged presence)
        {
            if (presence.isOnline())
            {
                onlineUsers.add(presence.userId());
            }
            else
            {
                onlineUsers.remove(presence.userId());
                typingUsers.remove(presence.userId());
            }
        }
        else if (event instanceof InboundEvent.Disconnected)
        {
            typingUsers.clear();
        }
    }

    private void sendTyping(boolean isTyping)
    {
        OutboundFrame frame = new OutboundFrame.Typing(roomId, isTyping);
        try
        {
            executor.execute(() ->
            {
                try
                {
                    connection.send(frame);
                }
                catch (ChatConnectionException e)
                {
                    LOG.debug("Typing indicator not sent: {}", e.getMessage());
                }
            });
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Typing indicator rejected: {}", e.getMessage());
        }
    }

    // ========== Queries ==========

    public List<Message> messages()
    {
        return tracker.messages();
    }

    public Set<String> getTypingUsers()
    {
        return Set.copyOf(typingUsers);
    }

    public Set<String> getOnlineUsers()
    {
        return Set.copyOf(onlineUsers);
    }

    public String getRoomId()
    {
        return roomId;
    }

    public void addDeliveryListener(DeliveryListener listener)
    {
        tracker.addListener(listener);
    }

    public void removeDeliveryListener(DeliveryListener listener)
    {
        tracker.removeListener(listener);
    }

    /**
     * Stops receiving events and cancels the typing timer.
     */
    @Override
    public void close()
    {
        subscription.close();
        debouncer.close();
        LOG.debug("Room {} closed", roomId);
    }
}
