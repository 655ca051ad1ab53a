package org.abstractica.chat;

import java.util.Objects;

/**
 * The signed-in user on this client.
 *
 * @param id   user id as known by the server
 * @param name display name
 */
public record LocalUser(String id, String name)
{
    public LocalUser
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
    }
}
