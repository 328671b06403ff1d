package br.com.ferroxide.chatstore.repository;

import br.com.ferroxide.chatstore.domain.Membership;
import br.com.ferroxide.chatstore.domain.MembershipId;
import br.com.ferroxide.chatstore.domain.Room;
import br.com.ferroxide.chatstore.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MembershipRepository extends JpaRepository<Membership, MembershipId> {

    // a plain insert, so an existing pair fails on the primary key
    @Modifying
    @Query(value = "insert into rooms_users (room_id, user_id) values (:roomId, :userId)", nativeQuery = true)
    int insertMembership(@Param("roomId") Long roomId, @Param("userId") Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Membership m where m.id.roomId = :roomId and m.id.userId = :userId")
    int deleteMembership(@Param("roomId") Long roomId, @Param("userId") Long userId);

    boolean existsByIdRoomIdAndIdUserId(Long roomId, Long userId);

    @Query("select r from Membership m join m.room r where m.id.userId = :userId order by r.name")
    List<Room> findRoomsOfUser(@Param("userId") Long userId);

    @Query("select u from Membership m join m.user u where m.id.roomId = :roomId order by u.username")
    List<User> findMembersOfRoom(@Param("roomId") Long roomId);
}
