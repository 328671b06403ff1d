package br.com.ferroxide.chatstore.service;

import br.com.ferroxide.chatstore.dto.room.RoomDTO;
import br.com.ferroxide.chatstore.dto.user.UserDTO;
import br.com.ferroxide.chatstore.error.StoreExceptionTranslator;
import br.com.ferroxide.chatstore.repository.MembershipRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.Assert;

import java.util.List;

@Service
@RequiredArgsConstructor
public class MembershipService {

    private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

    private final MembershipRepository membershipRepo;
    private final StoreExceptionTranslator translator;

    /**
     * Not an upsert. Callers that only want "is a member afterwards" may treat
     * {@link br.com.ferroxide.chatstore.error.exception.ConstraintViolationException} as success.
     *
     * @throws br.com.ferroxide.chatstore.error.exception.ConstraintViolationException if the pair
     *         already exists
     * @throws br.com.ferroxide.chatstore.error.exception.ReferentialIntegrityException if the room
     *         or the user does not exist
     */
    @Transactional
    public void addMembership(Long roomId, Long userId) {
        Assert.notNull(roomId, "roomId must not be null");
        Assert.notNull(userId, "userId must not be null");
        try {
            membershipRepo.insertMembership(roomId, userId);
        } catch (DataAccessException ex) {
            throw translator.translate(ex, "addMembership(room " + roomId + ", user " + userId + ")");
        }
        log.debug("User {} joined room {}", userId, roomId);
    }

    /**
     * @return whether a membership was removed; a missing pair is not an error
     */
    @Transactional
    public boolean removeMembership(Long roomId, Long userId) {
        int removed = membershipRepo.deleteMembership(roomId, userId);
        log.debug("User {} left room {} ({} row(s))", userId, roomId, removed);
        return removed > 0;
    }

    @Transactional(readOnly = true)
    public boolean isMember(Long roomId, Long userId) {
        return membershipRepo.existsByIdRoomIdAndIdUserId(roomId, userId);
    }

    /** Rooms the user belongs to, by name. Unknown users simply have none. */
    @Transactional(readOnly = true)
    public List<RoomDTO> fetchUserRooms(Long userId) {
        return membershipRepo.findRoomsOfUser(userId).stream()
                .map(RoomDTO::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<UserDTO> fetchRoomMembers(Long roomId) {
        return membershipRepo.findMembersOfRoom(roomId).stream()
                .map(UserDTO::from)
                .toList();
    }
}
