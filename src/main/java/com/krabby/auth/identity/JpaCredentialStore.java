package com.krabby.auth.identity;

import com.krabby.auth.identity.entities.ChatUser;
import com.krabby.auth.identity.entities.ChatUserRepository;
import com.krabby.auth.identity.entities.UserStatus;
import com.krabby.auth.identity.exceptions.CredentialStoreException;
import lombok.NonNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionTimedOutException;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link CredentialStore} backed by the {@code users} table. Connectivity failures and timeouts are
 * translated to {@link CredentialStoreException}s; everything else propagates untouched.
 */
@Component
class JpaCredentialStore implements CredentialStore {

    private final ChatUserRepository repository;

    @Autowired
    JpaCredentialStore(@NonNull ChatUserRepository repository) {
        this.repository = repository;
    }

    @NonNull
    @Override
    public Optional<ChatUser> findById(long identity) {
        return translate(() -> repository.findById(identity));
    }

    @NonNull
    @Override
    public Optional<ChatUser> findByEmail(@NonNull String email) {
        return translate(() -> repository.findByEmail(email));
    }

    @Override
    public boolean existsByEmail(@NonNull String email) {
        return translate(() -> repository.existsByEmail(email));
    }

    @NonNull
    @Override
    public ChatUser create(@NonNull ChatUser user) {
        return translate(() -> repository.save(user));
    }

    @Override
    public boolean storeTokens(long identity, @NonNull String accessToken, @NonNull String refreshToken) {
        return translate(() -> repository.updateTokens(
            identity, accessToken, refreshToken, UserStatus.ONLINE, OffsetDateTime.now()) > 0);
    }

    @Override
    public boolean rotateTokens(
        long identity,
        @NonNull String expectedRefreshToken,
        @NonNull String accessToken,
        @NonNull String refreshToken
    ) {
        return translate(() -> repository.rotateTokens(
            identity, expectedRefreshToken, accessToken, refreshToken, UserStatus.ONLINE, OffsetDateTime.now()) > 0);
    }

    @Override
    public boolean markLoggedOut(long identity) {
        return translate(() -> repository.updateLoggedOut(identity, UserStatus.OFFLINE, OffsetDateTime.now()) > 0);
    }

    private static <T> T translate(@NonNull Supplier<T> operation) {
        try {
            return operation.get();
        } catch (QueryTimeoutException | TransactionTimedOutException e) {
            throw new CredentialStoreException.TimedOut("credential store operation timed out", e);
        } catch (TransientDataAccessException | RecoverableDataAccessException | DataAccessResourceFailureException e) {
            throw new CredentialStoreException("credential store is unavailable", e);
        }
    }
}
