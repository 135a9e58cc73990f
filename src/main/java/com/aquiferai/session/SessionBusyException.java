package com.aquiferai.session;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class SessionBusyException extends ResponseStatusException {

    public SessionBusyException(String sessionId) {
        super(HttpStatus.CONFLICT, "Session " + sessionId + " is busy with another message");
    }
}
