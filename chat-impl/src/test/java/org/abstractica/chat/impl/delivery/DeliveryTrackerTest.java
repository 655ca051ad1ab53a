package org.abstractica.chat.impl.delivery;

import org.abstractica.chat.DeliveryState;
import org.abstractica.chat.InboundEvent;
import org.abstractica.chat.LocalUser;
import org.abstractica.chat.Message;
import org.abstractica.chat.NotConnectedException;
import org.abstractica.chat.OutboundFrame;
import org.abstractica.chat.TransportException;
import org.abstractica.chat.impl.client.FakeChatConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DeliveryTracker}.
 */
class DeliveryTrackerTest
{
    private static final LocalUser ME = new LocalUser("me", "Me");
    private static final String ROOM = "general";

    private FakeChatConnection connection;
    private Queue<Runnable> pendingSends;
    private DeliveryTracker tracker;
    private List<Message> changes;

    @BeforeEach
    void setUp()
    {
        connection = new FakeChatConnection();
        connection.setConnected(true);
        pendingSends = new ArrayDeque<>();
        tracker = new DeliveryTracker(connection, ME, ROOM, pendingSends::add);
        changes = new CopyOnWriteArrayList<>();
        tracker.addListener(changes::add);
    }

    // ========== Submit ==========

    @Test
    void submit_showsSendingBeforeSendCompletes()
    {
        Message message = tracker.submit("hi");

        assertEquals(new DeliveryState.Sending(), message.deliveryState());
        assertEquals(List.of(message), tracker.messages());
        assertTrue(connection.getSentFrames().isEmpty());
    }

    @Test
    void submit_sendSucceeds_marksSent()
    {
        Message message = tracker.submit("hi");

        runPendingSends();

        assertEquals(new DeliveryState.Sent(), tracker.find(message.id()).orElseThrow().deliveryState());
        assertEquals(List.of(new OutboundFrame.ChatMessage(message.id(), "hi", ROOM)), connection.getSentFrames());
    }

    @Test
    void submit_blank_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> tracker.submit("   "));
        assertTrue(tracker.messages().isEmpty());
    }

    @Test
    void submit_notConnected_marksFailedAndKeepsMessage()
    {
        connection.setConnected(false);

        Message message = tracker.submit("hi");
        runPendingSends();

        Message failed = tracker.find(message.id()).orElseThrow();
        DeliveryState.Failed state = assertInstanceOf(DeliveryState.Failed.class, failed.deliveryState());
        assertInstanceOf(NotConnectedException.class, state.cause());
        assertEquals(1, tracker.messages().size());
    }

    @Test
    void submit_executorRejects_marksFailed()
    {
        DeliveryTracker rejecting = new DeliveryTracker(connection, ME, ROOM, task ->
        {
            throw new RejectedExecutionException("shut down");
        });

        Message message = rejecting.submit("hi");

        assertInstanceOf(DeliveryState.Failed.class, rejecting.find(message.id()).orElseThrow().deliveryState());
    }

    // ========== Delivery ==========

    @Test
    void echo_fromLocalUser_marksDeliveredInPlace()
    {
        Message message = tracker.submit("hi");
        runPendingSends();

        tracker.onEvent(new InboundEvent.MessageReceived(echoOf(message)));

        assertEquals(1, tracker.messages().size());
        assertEquals(new DeliveryState.Delivered(), tracker.messages().get(0).deliveryState());
        assertEquals("hi", tracker.messages().get(0).content());
    }

    @Test
    void ack_marksDelivered()
    {
        Message message = tracker.submit("hi");
        runPendingSends();

        tracker.onEvent(new InboundEvent.MessageAck(message.id()));

        assertTrue(tracker.find(message.id()).orElseThrow().deliveryState().isDelivered());
    }

    @Test
    void echoBeforeSendReturns_staysDelivered()
    {
        Message message = tracker.submit("hi");

        tracker.onEvent(new InboundEvent.MessageReceived(echoOf(message)));
        runPendingSends();

        assertEquals(new DeliveryState.Delivered(), tracker.find(message.id()).orElseThrow().deliveryState());
    }

    @Test
    void listener_seesEachTransition()
    {
        Message message = tracker.submit("hi");
        runPendingSends();
        tracker.onEvent(new InboundEvent.MessageAck(message.id()));
        tracker.onEvent(new InboundEvent.MessageAck(message.id()));

        assertEquals(List.of(
                new DeliveryState.Sending(),
                new DeliveryState.Sent(),
                new DeliveryState.Delivered()),
                changes.stream().map(Message::deliveryState).toList());
    }

    @Test
    void ackDuringSentNotification_listenerSeesDeliveredLast() throws Exception
    {
        // Arrange
        DeliveryTracker threaded = new DeliveryTracker(connection, ME, ROOM, task -> new Thread(task).start());
        List<DeliveryState> observed = new CopyOnWriteArrayList<>();
        CountDownLatch sentNotifying = new CountDownLatch(1);
        threaded.addListener(message ->
        {
            if (message.deliveryState() instanceof DeliveryState.Sent)
            {
                sentNotifying.countDown();
                pause(200);
            }
            observed.add(message.deliveryState());
        });

        // Act
        Message message = threaded.submit("hi");
        assertTrue(sentNotifying.await(5, TimeUnit.SECONDS));
        threaded.onEvent(new InboundEvent.MessageAck(message.id()));

        // Assert
        assertEquals(List.of(
                new DeliveryState.Sending(),
                new DeliveryState.Sent(),
                new DeliveryState.Delivered()), observed);
        assertEquals(new DeliveryState.Delivered(), threaded.find(message.id()).orElseThrow().deliveryState());
    }

    @Test
    void ownEcho_withoutEntry_isDropped()
    {
        Message stray = remote("m-unknown", ME.id(), ROOM);

        tracker.onEvent(new InboundEvent.MessageReceived(stray));

        assertTrue(tracker.messages().isEmpty());
    }

    @Test
    void ack_unknownId_isIgnored()
    {
        tracker.onEvent(new InboundEvent.MessageAck("nope"));

        assertTrue(tracker.messages().isEmpty());
        assertTrue(changes.isEmpty());
    }

    // ========== Inbound ==========

    @Test
    void otherUsersMessage_isAppendedOnce()
    {
        Message incoming = remote("m1", "u2", ROOM);

        tracker.onEvent(new InboundEvent.MessageReceived(incoming));
        tracker.onEvent(new InboundEvent.MessageReceived(incoming));

        assertEquals(List.of(incoming), tracker.messages());
    }

    @Test
    void messageForOtherRoom_isIgnored()
    {
        tracker.onEvent(new InboundEvent.MessageReceived(remote("m1", "u2", "random")));

        assertTrue(tracker.messages().isEmpty());
    }

    @Test
    void messages_keepArrivalOrder()
    {
        tracker.onEvent(new InboundEvent.MessageReceived(remote("m1", "u2", ROOM)));
        Message mine = tracker.submit("reply");
        tracker.onEvent(new InboundEvent.MessageReceived(remote("m2", "u3", ROOM)));
        runPendingSends();

        assertEquals(List.of("m1", mine.id(), "m2"), tracker.messages().stream().map(Message::id).toList());
    }

    // ========== Retry ==========

    @Test
    void retry_failedMessage_resendsWithSameId()
    {
        connection.failSendsWith(new TransportException("broken", new IOException("reset")));
        Message message = tracker.submit("hi");
        runPendingSends();
        connection.failSendsWith(null);

        boolean retried = tracker.retry(message.id());

        assertTrue(retried);
        assertEquals(new DeliveryState.Sending(), tracker.find(message.id()).orElseThrow().deliveryState());
        runPendingSends();
        assertEquals(new DeliveryState.Sent(), tracker.find(message.id()).orElseThrow().deliveryState());
        assertEquals(List.of(new OutboundFrame.ChatMessage(message.id(), "hi", ROOM)), connection.getSentFrames());
        assertEquals(1, tracker.messages().size());
    }

    @Test
    void retry_notFailed_isNoOp()
    {
        Message message = tracker.submit("hi");

        assertFalse(tracker.retry(message.id()));
        assertFalse(tracker.retry("unknown"));
        assertEquals(1, pendingSends.size());
    }

    // ========== History ==========

    @Test
    void replaceHistory_keepsUnsentLocalMessages()
    {
        connection.setConnected(false);
        Message failed = tracker.submit("draft");
        runPendingSends();
        tracker.onEvent(new InboundEvent.MessageReceived(remote("live", "u2", ROOM)));

        tracker.replaceHistory(List.of(
                remote("h1", "u2", ROOM),
                remote("h2", "u3", "random"),
                remote("h3", ME.id(), ROOM)));

        assertEquals(List.of("h1", "h3", failed.id()), tracker.messages().stream().map(Message::id).toList());
    }

    // ========== Helpers ==========

    private void runPendingSends()
    {
        Runnable next;
        while ((next = pendingSends.poll()) != null)
        {
            next.run();
        }
    }

    private static Message echoOf(Message message)
    {
        return new Message(message.id(), ME.id(), ME.name(), message.content(), Instant.now(), ROOM,
                new DeliveryState.Delivered());
    }

    private static Message remote(String id, String senderId, String roomId)
    {
        return new Message(id, senderId, senderId.toUpperCase(), "text " + id,
                Instant.parse("2024-05-01T10:00:00Z"), roomId, new DeliveryState.Delivered());
    }

    private static void pause(long millis)
    {
        try
        {
            Thread.sleep(millis);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }
}
