package com.krabby.auth.identity.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link ChatUser} entity. Token
 * mutations are single bulk {@code update} statements so that both tokens of a pair are always
 * written together.
 */
@Repository
public interface ChatUserRepository extends CrudRepository<ChatUser, Long> {

    /**
     * Retrieves a user by its email.
     *
     * @param email must not be {@literal null}.
     * @return the user with the given email or {@literal Optional#empty()} if none found.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from ChatUser e where e.email = ?1")
    Optional<ChatUser> findByEmail(@NonNull String email);

    /**
     * Returns whether a user with the given email exists.
     *
     * @param email must not be {@literal null}.
     * @return {@literal true} if a user with the given email exists, {@literal false} otherwise.
     */
    @Transactional(readOnly = true)
    @Query("select case when count(e) > 0 then true else false end from ChatUser e where e.email = ?1")
    boolean existsByEmail(@NonNull String email);

    /**
     * Unconditionally replaces both tokens of a user and reopens its session.
     *
     * @return the number of updated rows, i.e. {@literal 0} if the user doesn't exist.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update ChatUser e set e.accessToken = ?2, e.refreshToken = ?3, e.loggedOut = false, " +
        "e.status = ?4, e.lastSeenAt = ?5, e.updatedAt = ?5 where e.id = ?1")
    int updateTokens(
        long id,
        @NonNull String accessToken,
        @NonNull String refreshToken,
        @NonNull UserStatus status,
        @NonNull OffsetDateTime now);

    /**
     * Replaces both tokens of a user only if its stored refresh token is still {@code
     * expectedRefreshToken} and its session is open. Of two concurrent calls with the same
     * expected token, at most one updates the row.
     *
     * @return the number of updated rows, i.e. {@literal 0} if the conditions didn't hold.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update ChatUser e set e.accessToken = ?3, e.refreshToken = ?4, e.status = ?5, " +
        "e.lastSeenAt = ?6, e.updatedAt = ?6 " +
        "where e.id = ?1 and e.refreshToken = ?2 and e.loggedOut = false")
    int rotateTokens(
        long id,
        @NonNull String expectedRefreshToken,
        @NonNull String accessToken,
        @NonNull String refreshToken,
        @NonNull UserStatus status,
        @NonNull OffsetDateTime now);

    /**
     * Closes the session of a user. The stored tokens are left in place.
     *
     * @return the number of updated rows, i.e. {@literal 0} if the user doesn't exist.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update ChatUser e set e.loggedOut = true, e.status = ?2, e.lastSeenAt = ?3, e.updatedAt = ?3 where e.id = ?1")
    int updateLoggedOut(long id, @NonNull UserStatus status, @NonNull OffsetDateTime now);
}
