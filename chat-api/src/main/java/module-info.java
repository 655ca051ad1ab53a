/**
 * Realtime chat API module.
 *
 * <p>Provides the interfaces and value types for a persistent, authenticated
 * chat connection with typed inbound events and delivery tracking.</p>
 */
module chat.api
{
    exports org.abstractica.chat;
    exports org.abstractica.chat.handlers;
}
