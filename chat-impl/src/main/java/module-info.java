/**
 * Realtime chat implementation module.
 *
 * <p>Provides the default implementation of the chat API.</p>
 */
module chat.impl
{
    requires chat.api;
    requires org.slf4j;
    requires java.net.http;
    requires java.prefs;
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;

    // Export connection factory and per-room consumers for external use
    exports org.abstractica.chat.impl.client;
    exports org.abstractica.chat.impl.room;
    exports org.abstractica.chat.impl.delivery;
    exports org.abstractica.chat.impl.typing;
    exports org.abstractica.chat.impl.transport;
    exports org.abstractica.chat.impl.credentials;
    exports org.abstractica.chat.impl.scheduling;

    // Export codec and backoff policy for protocol tooling
    exports org.abstractica.chat.impl.codec;
    exports org.abstractica.chat.impl.reliability;

    // Inbound payload records are bound reflectively
    opens org.abstractica.chat.impl.codec to com.fasterxml.jackson.databind;
}
