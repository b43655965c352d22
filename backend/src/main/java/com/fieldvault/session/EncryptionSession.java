package com.fieldvault.session;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fieldvault.crypto.DataKey;
import com.fieldvault.crypto.FieldCipher;
import com.fieldvault.crypto.FieldDecryptException;
import com.fieldvault.crypto.KeyDerivationException;
import com.fieldvault.crypto.KeyDeriver;
import com.fieldvault.crypto.SelfTestFailureException;
import com.fieldvault.policy.EncryptionProperties;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Owns the data key of the signed-in account.
 *
 * <p>State machine: {@code UNINITIALIZED -> INITIALIZING -> READY}, or
 * {@code INITIALIZING -> FAILED}, from which {@link #initialize(String)} may be called again.
 *
 * <p><strong>Single flight:</strong> concurrent {@code initialize} calls for the same account share
 * one derivation. Each derivation carries a generation ticket; {@link #clear()} and account switches
 * bump the generation, so a derivation that finishes late is destroyed instead of installed.
 *
 * <p>The key is only ever written here, under {@code lock}, and is replaced wholesale.
 */
@Component
public class EncryptionSession {

    private static final Logger log = LoggerFactory.getLogger(EncryptionSession.class);

    private static final String SELF_TEST_PREFIX = "self-test:";

    private final KeyDeriver keyDeriver;
    private final FieldCipher fieldCipher;
    private final Duration pollInterval;

    private final Object lock = new Object();

    private volatile KeyState state = KeyState.UNINITIALIZED;
    private volatile DataKey key;
    private volatile Throwable lastFailure;

    // guarded by lock
    private String accountId;
    private String pendingAccountId;
    private Mono<InitializationResult> inFlight;
    private long generation;

    @Autowired
    public EncryptionSession(KeyDeriver keyDeriver, FieldCipher fieldCipher, EncryptionProperties properties) {
        this(keyDeriver, fieldCipher, properties.pollInterval());
    }

    public EncryptionSession(KeyDeriver keyDeriver, FieldCipher fieldCipher, Duration pollInterval) {
        this.keyDeriver = keyDeriver;
        this.fieldCipher = fieldCipher;
        this.pollInterval = pollInterval;
    }

    /** Sign-in hook. */
    public Mono<InitializationResult> onSignIn(String accountId) {
        return initialize(accountId);
    }

    /** Sign-out hook. */
    public void onSignOut() {
        clear();
    }

    public Mono<InitializationResult> initialize(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            log.warn("Encryption initialization refused: no authenticated account");
            return Mono.just(InitializationResult.failed(
                    new KeyDerivationException("No authenticated account")));
        }

        synchronized (lock) {
            if (state == KeyState.READY && accountId.equals(this.accountId)) {
                return Mono.just(InitializationResult.ready());
            }
            if (inFlight != null && accountId.equals(pendingAccountId)) {
                log.debug("Encryption initialization already in progress, joining");
                return inFlight;
            }

            discardKey();
            this.accountId = null;
            long ticket = ++generation;
            state = KeyState.INITIALIZING;
            pendingAccountId = accountId;

            Mono<InitializationResult> attempt = Mono.fromCallable(() -> deriveAndVerify(accountId))
                    .subscribeOn(Schedulers.boundedElastic())
                    .map(derived -> install(ticket, accountId, derived))
                    .onErrorResume(e -> Mono.just(fail(ticket, e)))
                    .cache();
            inFlight = attempt;
            attempt.subscribe();
            return attempt;
        }
    }

    /**
     * Polls until the key is ready or {@code timeout} elapses. Never blocks past the timeout.
     * Returns at once when no initialization is running.
     */
    public boolean waitForReady(Duration timeout) {
        if (state != KeyState.INITIALIZING) {
            return isReady();
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        long step = Math.max(1, pollInterval.toNanos());
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return isReady();
            }
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(step, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return isReady();
            }
            if (state != KeyState.INITIALIZING) {
                return isReady();
            }
        }
    }

    public boolean isReady() {
        return state == KeyState.READY && key != null;
    }

    public KeyState state() {
        return state;
    }

    public Optional<DataKey> currentKey() {
        DataKey current = key;
        return state == KeyState.READY ? Optional.ofNullable(current) : Optional.empty();
    }

    public Optional<Throwable> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    /**
     * Drops the key and every flag. Derivations still running are invalidated.
     */
    public void clear() {
        synchronized (lock) {
            generation++;
            discardKey();
            accountId = null;
            pendingAccountId = null;
            inFlight = null;
            lastFailure = null;
            state = KeyState.UNINITIALIZED;
        }
        log.info("Encryption keys cleared");
    }

    private DataKey deriveAndVerify(String accountId) {
        DataKey derived = keyDeriver.deriveKey(accountId);
        try {
            selfTest(derived);
        } catch (RuntimeException e) {
            derived.destroy();
            throw e;
        }
        return derived;
    }

    private void selfTest(DataKey candidate) {
        String probe = SELF_TEST_PREFIX + UUID.randomUUID();
        Object roundTrip;
        try {
            roundTrip = fieldCipher.decrypt(candidate, fieldCipher.encrypt(candidate, probe));
        } catch (FieldDecryptException | RuntimeException e) {
            throw new SelfTestFailureException("Key self-test failed", e);
        }
        if (!probe.equals(roundTrip)) {
            throw new SelfTestFailureException("Key self-test round trip mismatch");
        }
    }

    private InitializationResult install(long ticket, String accountId, DataKey derived) {
        synchronized (lock) {
            if (ticket != generation) {
                derived.destroy();
                log.info("Discarding key from superseded initialization");
                return InitializationResult.failed(
                        new KeyDerivationException("Initialization superseded by sign-out or account switch"));
            }
            key = derived;
            this.accountId = accountId;
            pendingAccountId = null;
            inFlight = null;
            lastFailure = null;
            state = KeyState.READY;
        }
        log.info("Encryption initialized, key passed self-test");
        return InitializationResult.ready();
    }

    private InitializationResult fail(long ticket, Throwable error) {
        Throwable cause = error instanceof KeyDerivationException
                ? error
                : new KeyDerivationException("Key setup failed", error);
        synchronized (lock) {
            if (ticket == generation) {
                pendingAccountId = null;
                inFlight = null;
                lastFailure = cause;
                state = KeyState.FAILED;
            }
        }
        log.error("Encryption initialization failed", cause);
        return InitializationResult.failed(cause);
    }

    private void discardKey() {
        DataKey previous = key;
        key = null;
        if (previous != null) {
            previous.destroy();
        }
    }
}
