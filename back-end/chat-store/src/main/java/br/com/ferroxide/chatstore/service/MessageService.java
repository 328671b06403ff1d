package br.com.ferroxide.chatstore.service;

import br.com.ferroxide.chatstore.domain.IsoInstantConverter;
import br.com.ferroxide.chatstore.domain.Message;
import br.com.ferroxide.chatstore.domain.TimelineOrder;
import br.com.ferroxide.chatstore.dto.message.MessageDTO;
import br.com.ferroxide.chatstore.error.StoreExceptionTranslator;
import br.com.ferroxide.chatstore.repository.MessageRepository;
import br.com.ferroxide.chatstore.repository.RoomRepository;
import br.com.ferroxide.chatstore.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.Assert;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Room timelines. Messages are appended and read, never edited or removed one by one.
 */
@Service
@RequiredArgsConstructor
public class MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    public static final int MAX_PAGE_SIZE = 500;

    private final MessageRepository messageRepo;
    private final RoomRepository roomRepo;
    private final UserRepository userRepo;
    private final StoreExceptionTranslator translator;
    private final Clock clock;

    /**
     * @param timestamp send time chosen by the caller, years 0000 to 9999; {@code null} means now
     * @throws br.com.ferroxide.chatstore.error.exception.ReferentialIntegrityException if the room
     *         or the author does not exist
     */
    @Transactional
    public Long postMessage(Long roomId, Long userId, String content, Instant timestamp) {
        Assert.notNull(roomId, "roomId must not be null");
        Assert.notNull(userId, "userId must not be null");
        Assert.hasLength(content, "content must not be empty");
        Assert.isTrue(timestamp == null || IsoInstantConverter.isStorable(timestamp),
                () -> "timestamp must lie between " + IsoInstantConverter.MIN + " and " + IsoInstantConverter.MAX);

        Message m = Message.builder()
                .room(roomRepo.getReferenceById(roomId))
                .author(userRepo.getReferenceById(userId))
                .content(content)
                .sentAt(timestamp != null ? timestamp : clock.instant())
                .build();

        try {
            messageRepo.saveAndFlush(m);
        } catch (DataAccessException ex) {
            throw translator.translate(ex, "postMessage(room " + roomId + ", user " + userId + ")");
        }

        log.debug("Message {} appended to room {} by user {}", m.getId(), roomId, userId);
        return m.getId();
    }

    /**
     * One page of a room's messages in send order. Messages sharing a timestamp are ordered
     * by id in the same direction.
     *
     * @param page zero-based page index
     * @param size page size, 1 to {@value #MAX_PAGE_SIZE}
     */
    @Transactional(readOnly = true)
    public List<MessageDTO> fetchRoomTimeline(Long roomId, TimelineOrder order, int page, int size) {
        Assert.notNull(order, "order must not be null");
        Assert.isTrue(page >= 0, "page must not be negative");
        Assert.isTrue(size > 0 && size <= MAX_PAGE_SIZE, "size must be between 1 and " + MAX_PAGE_SIZE);

        return messageRepo.findByRoomId(roomId, PageRequest.of(page, size, order.toSort()))
                .map(MessageDTO::from)
                .getContent();
    }

    /** Messages posted after the given one, oldest first. A null cursor returns the whole room. */
    @Transactional(readOnly = true)
    public List<MessageDTO> fetchRoomTimelineSince(Long roomId, Long afterMessageId) {
        long cursor = afterMessageId == null ? 0L : afterMessageId;
        return messageRepo.findByRoomIdAndIdGreaterThanOrderByIdAsc(roomId, cursor).stream()
                .map(MessageDTO::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countMessages(Long roomId) {
        return messageRepo.countByRoomId(roomId);
    }
}
