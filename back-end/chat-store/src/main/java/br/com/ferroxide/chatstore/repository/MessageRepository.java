package br.com.ferroxide.chatstore.repository;

import br.com.ferroxide.chatstore.domain.Message;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MessageRepository extends JpaRepository<Message, Long> {

    // ordering comes from the Pageable, see TimelineOrder
    @EntityGraph(attributePaths = {"room", "author"})
    Slice<Message> findByRoomId(Long roomId, Pageable pageable);

    @EntityGraph(attributePaths = {"room", "author"})
    List<Message> findByRoomIdAndIdGreaterThanOrderByIdAsc(Long roomId, Long id);

    long countByRoomId(Long roomId);
}
