package com.fieldvault.session;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.fieldvault.codec.DocumentCodec;
import com.fieldvault.policy.PolicyRegistry;

import reactor.core.publisher.Mono;

/**
 * Session lifecycle hooks. The identity provider integration calls {@code POST} after sign-in
 * and {@code DELETE} on sign-out or account switch.
 */
@RestController
@RequestMapping("/api/session")
public class SessionController {

    private final EncryptionSession session;
    private final DocumentCodec codec;
    private final PolicyRegistry policies;

    public SessionController(EncryptionSession session, DocumentCodec codec, PolicyRegistry policies) {
        this.session = session;
        this.codec = codec;
        this.policies = policies;
    }

    @PostMapping
    public Mono<ResponseEntity<SessionResponse>> signIn(@RequestBody SignInRequest request) {
        if (request == null || request.accountId() == null || request.accountId().isBlank()) {
            return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(new SessionResponse(KeyState.UNINITIALIZED, "No authenticated account")));
        }
        return session.onSignIn(request.accountId())
                .map(result -> ResponseEntity
                        .status(result.isReady() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                        .body(SessionResponse.from(result)));
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> signOut() {
        return Mono.fromRunnable(session::onSignOut);
    }

    @GetMapping("/status")
    public EncryptionStatus status() {
        return new EncryptionStatus(
                policies.isEncryptionEnabled(),
                session.state(),
                session.isReady(),
                policies.schemeVersion(),
                codec.unencryptedWrites(),
                codec.degradedReads());
    }
}
