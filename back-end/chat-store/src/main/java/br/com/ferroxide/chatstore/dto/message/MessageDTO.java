package br.com.ferroxide.chatstore.dto.message;

import br.com.ferroxide.chatstore.domain.Message;

import java.time.Instant;

public record MessageDTO(
        Long id,
        Long roomId,
        Long authorId,
        String author,
        String content,
        Instant sentAt
) {

    public static MessageDTO from(Message m) {
        return new MessageDTO(
                m.getId(),
                m.getRoom().getId(),
                m.getAuthor().getId(),
                m.getAuthor().getUsername(),
                m.getContent(),
                m.getSentAt()
        );
    }
}
