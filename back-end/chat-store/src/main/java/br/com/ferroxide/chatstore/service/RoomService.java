package br.com.ferroxide.chatstore.service;

import br.com.ferroxide.chatstore.domain.Room;
import br.com.ferroxide.chatstore.dto.room.RoomDTO;
import br.com.ferroxide.chatstore.error.StoreExceptionTranslator;
import br.com.ferroxide.chatstore.error.exception.NotFoundException;
import br.com.ferroxide.chatstore.repository.RoomRepository;
import br.com.ferroxide.chatstore.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.Assert;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class RoomService {

    private static final Logger log = LoggerFactory.getLogger(RoomService.class);

    private final RoomRepository roomRepo;
    private final UserRepository userRepo;
    private final StoreExceptionTranslator translator;
    private final Clock clock;

    /**
     * The owner is referenced, not loaded: a missing owner surfaces as a foreign key failure.
     *
     * @throws br.com.ferroxide.chatstore.error.exception.ConstraintViolationException if the name
     *         is taken, compared case-insensitively
     * @throws br.com.ferroxide.chatstore.error.exception.ReferentialIntegrityException if the
     *         owner does not exist
     */
    @Transactional
    public Long createRoom(String name, Long ownerId, String iconHash, String passwordHash) {
        Assert.hasLength(name, "name must not be empty");
        Assert.notNull(ownerId, "ownerId must not be null");

        Room room = Room.builder()
                .name(name)
                .owner(userRepo.getReferenceById(ownerId))
                .iconHash(iconHash)
                .passwordHash(passwordHash)
                .createdAt(clock.instant())
                .build();

        try {
            roomRepo.saveAndFlush(room);
        } catch (DataAccessException ex) {
            throw translator.translate(ex, "createRoom(" + name + ", owner " + ownerId + ")");
        }

        log.info("Created room {} (id: {}, owner: {})", room.getName(), room.getId(), ownerId);
        return room.getId();
    }

    /** Removes the room with all its memberships and messages in one statement. */
    @Transactional
    public void deleteRoom(Long roomId) {
        Assert.notNull(roomId, "roomId must not be null");
        if (roomRepo.deleteRoomById(roomId) == 0) {
            throw new NotFoundException("Room", roomId);
        }
        log.info("Deleted room {}", roomId);
    }

    @Transactional(readOnly = true)
    public RoomDTO getRoom(Long roomId) {
        return RoomDTO.from(load(roomId));
    }

    @Transactional(readOnly = true)
    public Optional<RoomDTO> findByName(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        return roomRepo.findByNameIgnoreCase(name).map(RoomDTO::from);
    }

    @Transactional(readOnly = true)
    public List<RoomDTO> listRooms() {
        return roomRepo.findAllByOrderByNameAsc().stream()
                .map(RoomDTO::from)
                .toList();
    }

    /** Rooms without a stored password hash are open to everyone. */
    @Transactional(readOnly = true)
    public boolean isPasswordProtected(Long roomId) {
        return load(roomId).isPasswordProtected();
    }

    @Transactional(readOnly = true)
    public Optional<String> getPasswordHash(Long roomId) {
        return Optional.ofNullable(load(roomId).getPasswordHash());
    }

    @Transactional
    public void updateIcon(Long roomId, String iconHash) {
        Assert.notNull(roomId, "roomId must not be null");
        if (roomRepo.updateIconHash(roomId, iconHash) == 0) {
            throw new NotFoundException("Room", roomId);
        }
        log.debug("Icon of room {} set to {}", roomId, iconHash);
    }

    /** A null hash removes the password gate. */
    @Transactional
    public void updatePassword(Long roomId, String passwordHash) {
        Assert.notNull(roomId, "roomId must not be null");
        if (roomRepo.updatePasswordHash(roomId, passwordHash) == 0) {
            throw new NotFoundException("Room", roomId);
        }
        log.info("Password gate of room {} {}", roomId, passwordHash == null ? "removed" : "set");
    }

    private Room load(Long roomId) {
        Assert.notNull(roomId, "roomId must not be null");
        return roomRepo.findById(roomId)
                .orElseThrow(() -> new NotFoundException("Room", roomId));
    }
}
