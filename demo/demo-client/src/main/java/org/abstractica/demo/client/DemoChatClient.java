package org.abstractica.demo.client;

import org.abstractica.chat.AuthenticationFailedException;
import org.abstractica.chat.ChatConnection;
import org.abstractica.chat.ChatConnectionException;
import org.abstractica.chat.ConnectionState;
import org.abstractica.chat.DeliveryState;
import org.abstractica.chat.InboundEvent;
import org.abstractica.chat.LocalUser;
import org.abstractica.chat.Message;
import org.abstractica.chat.impl.client.ChatSessionLifecycle;
import org.abstractica.chat.impl.client.DefaultChatConnectionFactory;
import org.abstractica.chat.impl.credentials.PreferencesCredentialStore;
import org.abstractica.chat.impl.room.ChatRoom;
import org.abstractica.chat.impl.scheduling.ExecutorTaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Console chat client demonstrating library features.
 *
 * <p>Features demonstrated:</p>
 * <ul>
 *   <li>Connection configuration and token authentication</li>
 *   <li>Resuming a session from a stored token</li>
 *   <li>Connection state and server events</li>
 *   <li>Optimistic sending with delivery states and retry</li>
 *   <li>Typing indicators and presence</li>
 * </ul>
 */
public class DemoChatClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DemoChatClient.class);
    private static final String DEFAULT_URI = "ws://localhost:8080/ws";
    private static final String DEFAULT_ROOM = "general";

    private final ChatSessionLifecycle session;
    private final ChatRoom room;
    private final ExecutorTaskScheduler scheduler;
    private final ExecutorService sendExecutor;
    private final LocalUser user;

    public DemoChatClient(URI serverUri, LocalUser user, String roomId)
    {
        this.user = user;
        this.scheduler = new ExecutorTaskScheduler("demo-typing");
        this.sendExecutor = Executors.newSingleThreadExecutor(runnable ->
        {
            Thread thread = new Thread(runnable, "demo-send");
            thread.setDaemon(true);
            return thread;
        });

        ChatConnection connection = new DefaultChatConnectionFactory().builder()
                .serverUri(serverUri)
                .build();
        this.session = new ChatSessionLifecycle(connection, new PreferencesCredentialStore());
        this.room = new ChatRoom(connection, user, roomId, scheduler, sendExecutor);

        registerCallbacks(connection);
    }

    private void registerCallbacks(ChatConnection connection)
    {
        connection.onStateChanged(state -> System.out.println("* " + state.displayText()));

        connection.subscribe(this::handleEvent);

        room.addDeliveryListener(this::handleMessageChanged);
    }

    private void handleEvent(InboundEvent event)
    {
        if (event instanceof InboundEvent.UserTyping typing && !typing.userId().equals(user.id()))
        {
            if (typing.roomId().equals(room.getRoomId()))
            {
                System.out.printf("* %s %s%n", typing.userId(), typing.isTyping() ? "is typing..." : "stopped typing");
            }
        }
        else if (event instanceof InboundEvent.PresenceChanged presence)
        {
            System.out.printf("* %s is %s%n", presence.userId(), presence.isOnline() ? "online" : "offline");
        }
        else if (event instanceof InboundEvent.ServerError error)
        {
            System.out.println("! Server error: " + error.text());
        }
        else if (event instanceof InboundEvent.UserRegistered)
        {
            System.out.println("* A new user registered");
        }
    }

    private void handleMessageChanged(Message message)
    {
        if (!message.senderId().equals(user.id()))
        {
            System.out.printf("[%s] %s: %s%n", message.roomId(), message.senderName(), message.content());
        }
        else if (message.deliveryState() instanceof DeliveryState.Failed failed)
        {
            System.out.printf("! Not sent (%s): %s, '/retry %s' to resend%n", failed.reason(), message.content(), message.id());
        }
        else if (message.deliveryState().isDelivered())
        {
            System.out.printf("[%s] you: %s%n", message.roomId(), message.content());
        }
    }

    public void start()
    {
        try
        {
            if (!session.resume())
            {
                System.out.println("Not logged in. Use '/login <token>'.");
            }
        }
        catch (AuthenticationFailedException e)
        {
            System.out.println("Stored token no longer valid: " + e.getMessage());
        }
        catch (ChatConnectionException e)
        {
            System.out.println("Could not connect: " + e.getMessage());
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }

    public void runCommandLoop()
    {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                if (!line.startsWith("/"))
                {
                    say(line);
                    continue;
                }

                String[] parts = line.substring(1).trim().split("\\s+", 2);
                String command = parts[0].toLowerCase();
                String argument = parts.length > 1 ? parts[1] : "";

                switch (command)
                {
                    case "login" ->
                    {
                        if (argument.isEmpty())
                        {
                            System.out.println("Usage: /login <token>");
                        }
                        else
                        {
                            login(argument);
                        }
                    }
                    case "logout" -> session.logout();
                    case "type" -> room.setComposeText(argument);
                    case "retry" ->
                    {
                        if (!room.retry(argument))
                        {
                            System.out.println("No failed message with id " + argument);
                        }
                    }
                    case "who" ->
                    {
                        System.out.println("Online: " + room.getOnlineUsers());
                        System.out.println("Typing: " + room.getTypingUsers());
                    }
                    case "history" -> printMessages(room.messages());
                    case "state" -> System.out.println(describe(session.getConnection().getState()));
                    case "quit", "exit", "q" ->
                    {
                        System.out.println("Disconnecting...");
                        return;
                    }
                    case "help" ->
                    {
                        System.out.println("Commands:");
                        System.out.println("  <text>          - Send a message to the room");
                        System.out.println("  /login <token>  - Log in and remember the token");
                        System.out.println("  /logout         - Forget the token and disconnect");
                        System.out.println("  /type <text>    - Update the compose buffer (typing indicator)");
                        System.out.println("  /retry <id>     - Resend a failed message");
                        System.out.println("  /who            - Show online and typing users");
                        System.out.println("  /history        - Show the messages of this session");
                        System.out.println("  /state          - Show the connection state");
                        System.out.println("  /quit           - Disconnect and exit");
                    }
                    default -> System.out.println("Unknown command: " + command + " (type '/help' for commands)");
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    private void say(String text)
    {
        if (text.isBlank())
        {
            return;
        }
        room.setComposeText(text);
        room.sendMessage();
    }

    private void login(String token)
    {
        try
        {
            session.login(token);
        }
        catch (ChatConnectionException e)
        {
            System.out.println("Login failed: " + e.getMessage());
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }

    private static void printMessages(List<Message> messages)
    {
        for (Message message : messages)
        {
            System.out.printf("  %s %s: %s (%s)%n",
                    message.timestamp(), message.senderName(), message.content(),
                    message.deliveryState().getClass().getSimpleName());
        }
    }

    private static String describe(ConnectionState state)
    {
        if (state instanceof ConnectionState.Reconnecting reconnecting)
        {
            return state.displayText() + " attempt " + reconnecting.attempt()
                    + " in " + reconnecting.delay().toSeconds() + "s";
        }
        return state.displayText();
    }

    public void shutdown()
    {
        room.close();
        session.close();
        scheduler.close();
        sendExecutor.shutdownNow();
    }

    public static void main(String[] args)
    {
        String uri = DEFAULT_URI;
        String roomId = DEFAULT_ROOM;
        String userId = System.getProperty("user.name", "guest");
        String userName = null;

        // Parse arguments
        for (int i = 0; i < args.length; i++)
        {
            switch (args[i])
            {
                case "-s", "--server" ->
                {
                    if (i + 1 < args.length)
                    {
                        uri = args[++i];
                    }
                }
                case "-r", "--room" ->
                {
                    if (i + 1 < args.length)
                    {
                        roomId = args[++i];
                    }
                }
                case "-u", "--user" ->
                {
                    if (i + 1 < args.length)
                    {
                        userId = args[++i];
                    }
                }
                case "-n", "--name" ->
                {
                    if (i + 1 < args.length)
                    {
                        userName = args[++i];
                    }
                }
                case "--help" ->
                {
                    System.out.println("Usage: demo-client [options]");
                    System.out.println("Options:");
                    System.out.println("  -s, --server <uri>  WebSocket endpoint (default: " + DEFAULT_URI + ")");
                    System.out.println("  -r, --room <id>     Chat room (default: " + DEFAULT_ROOM + ")");
                    System.out.println("  -u, --user <id>     Your user id (default: login name)");
                    System.out.println("  -n, --name <name>   Your display name (default: user id)");
                    System.exit(0);
                }
                default -> System.err.println("Ignoring unknown option: " + args[i]);
            }
        }

        URI serverUri;
        try
        {
            serverUri = URI.create(uri);
        }
        catch (IllegalArgumentException e)
        {
            System.err.println("Invalid server URI: " + uri);
            System.exit(1);
            return;
        }

        LocalUser user = new LocalUser(userId, userName != null ? userName : userId);
        DemoChatClient client = new DemoChatClient(serverUri, user, roomId);
        System.out.printf("Room '%s' as %s. Type '/help' for commands.%n", roomId, user.name());

        client.start();
        client.runCommandLoop();

        // Cleanup
        client.shutdown();
    }
}
