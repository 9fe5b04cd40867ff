package com.krabby.auth.identity;

import com.krabby.auth.config.AppConfiguration;
import com.krabby.auth.identity.entities.ChatUser;
import com.krabby.auth.identity.exceptions.DuplicateEmailException;
import com.krabby.auth.identity.exceptions.InvalidCredentialsException;
import com.krabby.auth.identity.exceptions.UnauthenticatedException;
import com.krabby.auth.identity.payload.LoginParams;
import com.krabby.auth.identity.payload.RegisterParams;
import com.krabby.auth.platform.RequestDeadline;
import com.krabby.auth.platform.RequestTimeoutException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Account level operations: registration, login and resolving access tokens for the security
 * filters. Every call gets one deadline of {@code server.request_timeout}. Password hashing runs
 * on a dedicated executor and is only awaited for the time that remains, and the final write
 * rolls back if the deadline passes before it commits.
 */
@Slf4j
@Service
class AccountService {

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final TokenLifecycleManager tokenLifecycleManager;
    private final Executor passwordHashingExecutor;
    private final PlatformTransactionManager transactionManager;
    private final Duration requestTimeout;

    @Autowired
    AccountService(
        @NonNull CredentialStore credentialStore,
        @NonNull PasswordHasher passwordHasher,
        @NonNull TokenLifecycleManager tokenLifecycleManager,
        @NonNull @Qualifier(AuthBeans.PASSWORD_HASHING_EXECUTOR) Executor passwordHashingExecutor,
        @NonNull PlatformTransactionManager transactionManager,
        @NonNull AppConfiguration config
    ) {
        this(
            credentialStore,
            passwordHasher,
            tokenLifecycleManager,
            passwordHashingExecutor,
            transactionManager,
            config.getServer().getRequestTimeout());
    }

    AccountService(
        @NonNull CredentialStore credentialStore,
        @NonNull PasswordHasher passwordHasher,
        @NonNull TokenLifecycleManager tokenLifecycleManager,
        @NonNull Executor passwordHashingExecutor,
        @NonNull PlatformTransactionManager transactionManager,
        @NonNull Duration requestTimeout
    ) {
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.tokenLifecycleManager = tokenLifecycleManager;
        this.passwordHashingExecutor = passwordHashingExecutor;
        this.transactionManager = transactionManager;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Creates a new account. It doesn't sign the user in.
     *
     * @throws DuplicateEmailException if an account with the given email already exists.
     */
    void register(@NonNull RegisterParams params) throws DuplicateEmailException {
        val deadline = RequestDeadline.start(requestTimeout);
        val email = normalizeEmail(params.getEmail());
        if (credentialStore.existsByEmail(email)) {
            throw new DuplicateEmailException("account with the given email already exists", null);
        }

        deadline.check("looking up the email");
        val passwordHash = awaitHashing(deadline, () -> passwordHasher.hash(params.getPassword()));
        final ChatUser user;
        try {
            user = beforeDeadline(deadline, "creating the account", status -> credentialStore.create(ChatUser.builder()
                .email(email)
                .fullName(params.getFullName().trim())
                .passwordHash(passwordHash)
                .build()));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateEmailException("account with the given email was created concurrently", e);
        }

        log.info("registered account {}", user.getId());
    }

    /**
     * Verifies the email and password and issues a fresh token pair on success.
     *
     * @throws InvalidCredentialsException if the account doesn't exist, is inactive or the
     *                                     password doesn't match.
     */
    @NonNull
    TokenPair login(@NonNull LoginParams params) throws InvalidCredentialsException {
        val deadline = RequestDeadline.start(requestTimeout);
        val user = credentialStore.findByEmail(normalizeEmail(params.getEmail()));
        val storedHash = user.map(ChatUser::getPasswordHash).orElse(null);
        deadline.check("looking up the account");

        // unknown accounts still pay for a verification against a decoy hash.
        val passwordMatches = awaitHashing(deadline, () -> passwordHasher.verify(params.getPassword(), storedHash));
        if (user.isEmpty() || !passwordMatches || !user.get().isActive()) {
            log.debug("login rejected (account found: {}, password matches: {})", user.isPresent(), passwordMatches);
            throw new InvalidCredentialsException("email or password is not valid");
        }

        val identity = user.get().getId();
        final TokenPair pair = beforeDeadline(deadline, "issuing tokens", status -> {
            try {
                return tokenLifecycleManager.issue(identity);
            } catch (UnauthenticatedException e) {
                log.debug("account {} disappeared before tokens were issued", identity, e);
                status.setRollbackOnly();
                return null;
            }
        });

        if (pair == null) {
            throw new InvalidCredentialsException("account disappeared before tokens were issued");
        }

        return pair;
    }

    /**
     * @return a non-null {@link Authentication} whose principal is the account id if the access
     * token is valid, {@literal null} otherwise.
     */
    Authentication verifyAccessToken(@NonNull String token) {
        try {
            return new AccessTokenAuthentication(token, tokenLifecycleManager.authenticate(token));
        } catch (UnauthenticatedException e) {
            log.trace("access token rejected", e);
            return null;
        }
    }

    private <T> T awaitHashing(@NonNull RequestDeadline deadline, @NonNull Supplier<T> task) {
        final CompletableFuture<T> future = CompletableFuture.supplyAsync(task, passwordHashingExecutor);
        try {
            return future.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RequestTimeoutException("password hashing exceeded the request timeout", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestTimeoutException("interrupted while hashing a password", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("password hashing failed", e.getCause());
        }
    }

    /**
     * Runs {@code work} in a transaction bounded by the remaining time and rolls it back if the
     * deadline passes before it commits.
     */
    private <T> T beforeDeadline(
        @NonNull RequestDeadline deadline,
        @NonNull String step,
        @NonNull Function<TransactionStatus, T> work
    ) {
        deadline.check("waiting to start " + step);
        val transaction = new TransactionTemplate(transactionManager);
        transaction.setTimeout(deadline.remainingSeconds());
        return transaction.execute(status -> {
            final T result = work.apply(status);
            deadline.check(step);
            return result;
        });
    }

    @NonNull
    private static String normalizeEmail(@NonNull String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static class AccessTokenAuthentication extends AbstractAuthenticationToken {

        private final String token;
        private final long accountId;

        AccessTokenAuthentication(@NonNull String token, long accountId) {
            super(List.of());
            this.token = token;
            this.accountId = accountId;
        }

        @Override
        public Object getCredentials() {
            return token;
        }

        @Override
        public Object getPrincipal() {
            return accountId;
        }

        @Override
        public boolean isAuthenticated() {
            return true;
        }
    }
}
