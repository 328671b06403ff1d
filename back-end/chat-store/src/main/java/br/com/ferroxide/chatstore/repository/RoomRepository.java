package br.com.ferroxide.chatstore.repository;

import br.com.ferroxide.chatstore.domain.Room;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RoomRepository extends JpaRepository<Room, Long> {

    Optional<Room> findByNameIgnoreCase(String name);

    List<Room> findAllByOrderByNameAsc();

    /**
     * Single-statement delete; the engine cascades memberships and messages.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Room r where r.id = :id")
    int deleteRoomById(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Room r set r.iconHash = :iconHash where r.id = :id")
    int updateIconHash(@Param("id") Long id, @Param("iconHash") String iconHash);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Room r set r.passwordHash = :passwordHash where r.id = :id")
    int updatePasswordHash(@Param("id") Long id, @Param("passwordHash") String passwordHash);
}
