package br.com.ferroxide.chatstore.dto.user;

import br.com.ferroxide.chatstore.domain.User;

import java.time.Instant;

public record UserDTO(
        Long id,
        String username,
        Instant createdAt,
        String avatarHash
) {

    public static UserDTO from(User u) {
        return new UserDTO(u.getId(), u.getUsername(), u.getCreatedAt(), u.getAvatarHash());
    }
}
