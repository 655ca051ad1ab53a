/**
 * Demo client module.
 *
 * <p>Console chat client built on the chat connection library.</p>
 */
module demo.client
{
    requires chat.api;
    requires chat.impl;
    requires org.slf4j;
}
