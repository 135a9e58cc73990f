package com.aquiferai.api;

import com.aquiferai.session.SessionMessage;
import com.aquiferai.session.SessionStore;
import com.aquiferai.session.SessionSummary;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v2/chat/sessions")
public class SessionController {

    private final SessionStore sessionStore;

    public SessionController(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SessionSummary create(@Valid @RequestBody(required = false) CreateSessionRequest request) {
        return sessionStore.createSession(request != null ? request.title() : null);
    }

    @GetMapping
    public List<SessionSummary> list() {
        return sessionStore.listSessions();
    }

    @GetMapping("/{sessionId}/history")
    public List<SessionMessage> history(@PathVariable String sessionId) {
        return sessionStore.history(sessionId);
    }

    @PutMapping("/{sessionId}/title")
    public SessionSummary rename(@PathVariable String sessionId, @Valid @RequestBody RenameSessionRequest request) {
        return sessionStore.rename(sessionId, request.title());
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String sessionId) {
        sessionStore.delete(sessionId);
    }
}
