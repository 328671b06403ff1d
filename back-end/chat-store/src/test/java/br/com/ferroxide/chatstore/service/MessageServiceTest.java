package br.com.ferroxide.chatstore.service;

import br.com.ferroxide.chatstore.domain.TimelineOrder;
import br.com.ferroxide.chatstore.dto.message.MessageDTO;
import br.com.ferroxide.chatstore.error.exception.ReferentialIntegrityException;
import br.com.ferroxide.chatstore.support.StoreIntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageServiceTest extends StoreIntegrationTestSupport {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    @Autowired
    private UserService userService;

    @Autowired
    private RoomService roomService;

    @Autowired
    private MessageService messageService;

    private Long bob;
    private Long alice;
    private Long general;
    private Long random;

    @BeforeEach
    void setUp() {
        bob = userService.createUser("Bob", "h", null);
        alice = userService.createUser("Alice", "h", null);
        general = roomService.createRoom("general", bob, null, null);
        random = roomService.createRoom("random", bob, null, null);
    }

    @Test
    @DisplayName("the timeline follows send time in the requested direction, whatever the insert order")
    void timelineOrdering() {
        // posted out of order on purpose
        messageService.postMessage(general, bob, "third", T0.plusSeconds(20));
        messageService.postMessage(general, alice, "first", T0);
        messageService.postMessage(general, bob, "second", T0.plusMillis(10_500));

        assertThat(messageService.fetchRoomTimeline(general, TimelineOrder.OLDEST_FIRST, 0, 50))
                .extracting(MessageDTO::content)
                .containsExactly("first", "second", "third");
        assertThat(messageService.fetchRoomTimeline(general, TimelineOrder.NEWEST_FIRST, 0, 50))
                .extracting(MessageDTO::content)
                .containsExactly("third", "second", "first");
    }

    @Test
    @DisplayName("the timeline contains only messages of the requested room")
    void timelineIsolation() {
        messageService.postMessage(general, bob, "in general", T0);
        messageService.postMessage(random, bob, "in random", T0.plusSeconds(1));

        List<MessageDTO> timeline = messageService.fetchRoomTimeline(general, TimelineOrder.OLDEST_FIRST, 0, 50);

        assertThat(timeline).hasSize(1);
        assertThat(timeline).allSatisfy(m -> assertThat(m.roomId()).isEqualTo(general));
        assertThat(timeline.get(0).author()).isEqualTo("Bob");
        assertThat(timeline.get(0).authorId()).isEqualTo(bob);
        assertThat(timeline.get(0).sentAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("messages sharing a timestamp keep their insertion order")
    void sameTimestampTieBreak() {
        Long a = messageService.postMessage(general, bob, "a", T0);
        Long b = messageService.postMessage(general, bob, "b", T0);

        assertThat(messageService.fetchRoomTimeline(general, TimelineOrder.OLDEST_FIRST, 0, 10))
                .extracting(MessageDTO::id).containsExactly(a, b);
        assertThat(messageService.fetchRoomTimeline(general, TimelineOrder.NEWEST_FIRST, 0, 10))
                .extracting(MessageDTO::id).containsExactly(b, a);
    }

    @Test
    @DisplayName("pages walk the timeline without gaps or overlaps")
    void pagination() {
        for (int i = 0; i < 7; i++) {
            messageService.postMessage(general, alice, "m" + i, T0.plusSeconds(i));
        }

        assertThat(messageService.fetchRoomTimeline(general, TimelineOrder.NEWEST_FIRST, 0, 3))
                .extracting(MessageDTO::content).containsExactly("m6", "m5", "m4");
        assertThat(messageService.fetchRoomTimeline(general, TimelineOrder.NEWEST_FIRST, 1, 3))
                .extracting(MessageDTO::content).containsExactly("m3", "m2", "m1");
        assertThat(messageService.fetchRoomTimeline(general, TimelineOrder.NEWEST_FIRST, 2, 3))
                .extracting(MessageDTO::content).containsExactly("m0");
        assertThat(messageService.fetchRoomTimeline(general, TimelineOrder.NEWEST_FIRST, 3, 3)).isEmpty();
    }

    @Test
    @DisplayName("page arguments outside the accepted range are rejected")
    void invalidPaging() {
        assertThatThrownBy(() -> messageService.fetchRoomTimeline(general, TimelineOrder.OLDEST_FIRST, -1, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> messageService.fetchRoomTimeline(general, TimelineOrder.OLDEST_FIRST, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> messageService.fetchRoomTimeline(
                general, TimelineOrder.OLDEST_FIRST, 0, MessageService.MAX_PAGE_SIZE + 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("fetchRoomTimelineSince returns only messages after the cursor")
    void timelineSince() {
        Long first = messageService.postMessage(general, bob, "one", T0);
        messageService.postMessage(general, bob, "two", T0.plusSeconds(1));
        messageService.postMessage(random, bob, "noise", T0.plusSeconds(2));
        messageService.postMessage(general, alice, "three", T0.plusSeconds(3));

        assertThat(messageService.fetchRoomTimelineSince(general, first))
                .extracting(MessageDTO::content).containsExactly("two", "three");
        assertThat(messageService.fetchRoomTimelineSince(general, null)).hasSize(3);
        assertThat(messageService.countMessages(general)).isEqualTo(3);
    }

    @Test
    @DisplayName("posting to a missing room or as a missing user is a referential error")
    void danglingReferences() {
        assertThatThrownBy(() -> messageService.postMessage(404L, bob, "lost", T0))
                .isInstanceOf(ReferentialIntegrityException.class);
        assertThatThrownBy(() -> messageService.postMessage(general, 404L, "lost", T0))
                .isInstanceOf(ReferentialIntegrityException.class);

        assertThat(countRows("select count(*) from messages")).isZero();
    }

    @Test
    @DisplayName("empty content is rejected; a missing timestamp means now")
    void contentAndDefaultTimestamp() {
        assertThatThrownBy(() -> messageService.postMessage(general, bob, "", T0))
                .isInstanceOf(IllegalArgumentException.class);

        Instant before = Instant.now().minusSeconds(1);
        messageService.postMessage(general, bob, "now", null);

        MessageDTO stored = messageService.fetchRoomTimeline(general, TimelineOrder.OLDEST_FIRST, 0, 1).get(0);
        assertThat(stored.sentAt()).isAfter(before);
    }

    @Test
    @DisplayName("timestamps beyond year 9999 are rejected and leave the timeline untouched")
    void farFutureTimestamp() {
        messageService.postMessage(general, bob, "now", T0);

        assertThatThrownBy(() -> messageService.postMessage(general, bob, "later", Instant.parse("+10000-01-01T00:00:00Z")))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(messageService.fetchRoomTimeline(general, TimelineOrder.NEWEST_FIRST, 0, 10))
                .extracting(MessageDTO::content).containsExactly("now");
    }

    @Test
    @DisplayName("timestamps are stored as fixed-width UTC text")
    void storedTimestampFormat() {
        messageService.postMessage(general, bob, "hi", Instant.parse("2024-03-01T12:00:00.5Z"));

        String raw = jdbc.queryForObject("select timestamp from messages", String.class);

        assertThat(raw).isEqualTo("2024-03-01T12:00:00.500000Z");
    }
}
