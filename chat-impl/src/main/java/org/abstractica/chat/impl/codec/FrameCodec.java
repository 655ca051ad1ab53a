package org.abstractica.chat.impl.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.abstractica.chat.FrameEncodingException;
import org.abstractica.chat.InboundEvent;
import org.abstractica.chat.OutboundFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Encodes outbound intents and decodes inbound frames of the chat wire protocol.
 *
 * <p>Frames are UTF-8 text. Keepalives are the literal strings {@code ping} and
 * {@code pong}; every other frame is a JSON object with a {@code type}
 * discriminator. Decoding never throws: frames that cannot be understood
 * decode to {@link InboundFrame.Ignored}.</p>
 */
public final class FrameCodec
{
    private static final Logger LOG = LoggerFactory.getLogger(FrameCodec.class);

    /**
     * Literal keepalive request.
     */
    public static final String PING = "ping";

    /**
     * Literal keepalive reply.
     */
    public static final String PONG = "pong";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private FrameCodec() {}

    // ========== Encoding ==========

    /**
     * Encodes an outbound frame.
     *
     * @param frame the frame to encode
     * @return the text payload
     * @throws FrameEncodingException if the frame cannot be serialized
     */
    public static String encode(OutboundFrame frame) throws FrameEncodingException
    {
        Objects.requireNonNull(frame, "frame");

        if (frame instanceof OutboundFrame.Ping)
        {
            return PING;
        }
        if (frame instanceof OutboundFrame.Pong)
        {
            return PONG;
        }

        ObjectNode node = MAPPER.createObjectNode();
        if (frame instanceof OutboundFrame.Auth auth)
        {
            node.put("type", "auth");
            node.put("token", auth.token());
        }
        else if (frame instanceof OutboundFrame.ChatMessage message)
        {
            node.put("type", "message");
            node.put("id", message.id());
            node.put("content", message.content());
            node.put("chatRoomId", message.roomId());
        }
        else if (frame instanceof OutboundFrame.Typing typing)
        {
            node.put("type", "typing");
            node.put("chatRoomId", typing.roomId());
            node.put("isTyping", typing.isTyping());
        }
        else
        {
            throw new FrameEncodingException("Unknown frame type: " + frame.getClass().getSimpleName(), null);
        }

        try
        {
            return MAPPER.writeValueAsString(node);
        }
        catch (JsonProcessingException e)
        {
            throw new FrameEncodingException("Failed to encode " + frame.getClass().getSimpleName(), e);
        }
    }

    // ========== Decoding ==========

    /**
     * Decodes an inbound text frame.
     *
     * @param text the frame text
     * @return the decoded frame, {@link InboundFrame.Ignored} if not understood
     */
    public static InboundFrame decode(String text)
    {
        Objects.requireNonNull(text, "text");

        if (text.equals(PING))
        {
            return new InboundFrame.Ping();
        }
        if (text.equals(PONG))
        {
            return new InboundFrame.Pong();
        }
        if (!text.startsWith("{") && !text.startsWith("["))
        {
            return ignored("Plain text frame: " + abbreviate(text));
        }

        JsonNode root;
        try
        {
            root = MAPPER.readTree(text);
        }
        catch (JsonProcessingException e)
        {
            return ignored("Malformed JSON: " + e.getOriginalMessage());
        }

        if (root == null || !root.isObject())
        {
            return ignored("JSON frame is not an object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual())
        {
            return ignored("JSON frame missing 'type' field");
        }

        String type = typeNode.asText();
        return switch (type)
        {
            case "success", "connected" -> decodeAuthResult(type, root);
            case "message" -> decodeMessage(root);
            case "messageAck" -> decodeMessageAck(root);
            case "typing" -> decodeTyping(root);
            case "status", "userStatus" -> decodeStatus(root);
            case "userRegistered" -> new InboundFrame.Event(new InboundEvent.UserRegistered());
            case "error" -> decodeError(root);
            default -> ignored("Unknown frame type: " + type);
        };
    }

    private static InboundFrame decodeAuthResult(String type, JsonNode root)
    {
        JsonNode authenticated = root.get("authenticated");
        if (authenticated == null || !authenticated.isBoolean())
        {
            return ignored("Informational '" + type + "' frame: " + textOrEmpty(root, "message"));
        }
        if (authenticated.booleanValue())
        {
            return new InboundFrame.AuthAccepted();
        }
        return new InboundFrame.AuthRejected(textOrEmpty(root, "message"));
    }

    private static InboundFrame decodeMessage(JsonNode root)
    {
        try
        {
            MessagePayload payload = MAPPER.treeToValue(root, MessagePayload.class);
            return new InboundFrame.Event(new InboundEvent.MessageReceived(payload.toMessage()));
        }
        catch (JsonProcessingException | IllegalArgumentException e)
        {
            return ignored("Failed to decode message: " + e.getMessage());
        }
    }

    private static InboundFrame decodeMessageAck(JsonNode root)
    {
        String messageId = text(root, "messageId");
        if (messageId == null)
        {
            return ignored("Ack frame missing 'messageId'");
        }
        return new InboundFrame.Event(new InboundEvent.MessageAck(messageId));
    }

    private static InboundFrame decodeTyping(JsonNode root)
    {
        String userId = text(root, "userId");
        String roomId = text(root, "chatRoomId");
        JsonNode isTyping = root.get("isTyping");
        if (userId == null || roomId == null || isTyping == null || !isTyping.isBoolean())
        {
            return ignored("Incomplete typing frame");
        }
        return new InboundFrame.Event(new InboundEvent.UserTyping(userId, roomId, isTyping.booleanValue()));
    }

    private static InboundFrame decodeStatus(JsonNode root)
    {
        String userId = text(root, "userId");
        JsonNode isOnline = root.get("isOnline");
        if (userId == null || isOnline == null || !isOnline.isBoolean())
        {
            return ignored("Incomplete status frame");
        }
        return new InboundFrame.Event(new InboundEvent.PresenceChanged(userId, isOnline.booleanValue()));
    }

    private static InboundFrame decodeError(JsonNode root)
    {
        String message = text(root, "message");
        if (message == null)
        {
            return ignored("Error frame missing 'message'");
        }
        return new InboundFrame.Event(new InboundEvent.ServerError(message));
    }

    // ========== Helpers ==========

    private static InboundFrame.Ignored ignored(String reason)
    {
        LOG.debug("Dropping frame: {}", reason);
        return new InboundFrame.Ignored(reason);
    }

    private static String text(JsonNode root, String field)
    {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static String textOrEmpty(JsonNode root, String field)
    {
        String value = text(root, field);
        return value != null ? value : "";
    }

    private static String abbreviate(String text)
    {
        return text.length() <= 64 ? text : text.substring(0, 64) + "...";
    }
}
