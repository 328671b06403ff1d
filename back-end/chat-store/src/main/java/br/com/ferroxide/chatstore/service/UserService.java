package br.com.ferroxide.chatstore.service;

import br.com.ferroxide.chatstore.domain.User;
import br.com.ferroxide.chatstore.dto.user.UserDTO;
import br.com.ferroxide.chatstore.error.StoreExceptionTranslator;
import br.com.ferroxide.chatstore.error.exception.NotFoundException;
import br.com.ferroxide.chatstore.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.Assert;

import java.time.Clock;
import java.util.Optional;

/**
 * Accounts. Credentials and avatar hashes arrive already hashed; nothing here sees plaintext.
 */
@Service
@RequiredArgsConstructor
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepo;
    private final StoreExceptionTranslator translator;
    private final Clock clock;

    /**
     * @throws br.com.ferroxide.chatstore.error.exception.ConstraintViolationException if the
     *         username is taken, compared case-insensitively
     */
    @Transactional
    public Long createUser(String username, String passwordHash, String avatarHash) {
        Assert.hasLength(username, "username must not be empty");
        Assert.hasLength(passwordHash, "passwordHash must not be empty");

        User user = User.builder()
                .username(username)
                .passwordHash(passwordHash)
                .avatarHash(avatarHash)
                .createdAt(clock.instant())
                .build();

        try {
            userRepo.saveAndFlush(user);
        } catch (DataAccessException ex) {
            throw translator.translate(ex, "createUser(" + username + ")");
        }

        log.info("Created user {} (id: {})", user.getUsername(), user.getId());
        return user.getId();
    }

    /**
     * Removes the account together with the rooms it owns, its memberships and its messages,
     * and the memberships and messages of those rooms, in one statement.
     */
    @Transactional
    public void deleteUser(Long userId) {
        Assert.notNull(userId, "userId must not be null");
        if (userRepo.deleteUserById(userId) == 0) {
            throw new NotFoundException("User", userId);
        }
        log.info("Deleted user {}", userId);
    }

    @Transactional(readOnly = true)
    public UserDTO getUser(Long userId) {
        return UserDTO.from(load(userId));
    }

    @Transactional(readOnly = true)
    public Optional<UserDTO> findByUsername(String username) {
        if (username == null || username.isEmpty()) {
            return Optional.empty();
        }
        return userRepo.findByUsernameIgnoreCase(username).map(UserDTO::from);
    }

    @Transactional(readOnly = true)
    public String getPasswordHash(Long userId) {
        return load(userId).getPasswordHash();
    }

    /** A null hash clears the avatar. Single statement, so it never reads before writing. */
    @Transactional
    public void updateAvatar(Long userId, String avatarHash) {
        Assert.notNull(userId, "userId must not be null");
        if (userRepo.updateAvatarHash(userId, avatarHash) == 0) {
            throw new NotFoundException("User", userId);
        }
        log.debug("Avatar of user {} set to {}", userId, avatarHash);
    }

    private User load(Long userId) {
        Assert.notNull(userId, "userId must not be null");
        return userRepo.findById(userId)
                .orElseThrow(() -> new NotFoundException("User", userId));
    }
}
