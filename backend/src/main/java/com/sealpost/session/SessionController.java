package com.sealpost.session;

import com.sealpost.crypto.LocalKeySigner;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/session")
public class SessionController {

    private final SessionManager sessionManager;

    public SessionController(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    /**
     * Logs in with a local secret key and starts syncing. The key stays in memory only.
     */
    @PostMapping("/login")
    public Mono<SessionResponse> login(@RequestBody LoginRequest request) {
        return Mono.fromCallable(() -> LocalKeySigner.fromHex(request.secretKey()))
                .map(sessionManager::login)
                .map(session -> new SessionResponse(session.localPubkey()));
    }

    @PostMapping("/logout")
    public Mono<Void> logout() {
        return Mono.fromRunnable(sessionManager::logout);
    }

    @GetMapping
    public Mono<SessionResponse> current() {
        return Mono.fromCallable(() -> new SessionResponse(sessionManager.current().localPubkey()));
    }
}
