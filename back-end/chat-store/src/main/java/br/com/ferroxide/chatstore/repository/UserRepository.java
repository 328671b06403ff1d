package br.com.ferroxide.chatstore.repository;

import br.com.ferroxide.chatstore.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByUsernameIgnoreCase(String username);

    /**
     * Single-statement delete; the engine cascades owned rooms, memberships and messages.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from User u where u.id = :id")
    int deleteUserById(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update User u set u.avatarHash = :avatarHash where u.id = :id")
    int updateAvatarHash(@Param("id") Long id, @Param("avatarHash") String avatarHash);
}
