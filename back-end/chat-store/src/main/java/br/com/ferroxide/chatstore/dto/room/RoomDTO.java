package br.com.ferroxide.chatstore.dto.room;

import br.com.ferroxide.chatstore.domain.Room;

import java.time.Instant;

/** Room as seen by readers. The password hash itself is never part of it. */
public record RoomDTO(
        Long id,
        String name,
        Long ownerId,
        Instant createdAt,
        String iconHash,
        boolean passwordProtected
) {

    public static RoomDTO from(Room r) {
        return new RoomDTO(
                r.getId(),
                r.getName(),
                r.getOwner().getId(),
                r.getCreatedAt(),
                r.getIconHash(),
                r.isPasswordProtected()
        );
    }
}
