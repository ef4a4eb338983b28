package com.taskflow.backend.modules.auth.application;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.taskflow.backend.global.error.ProblemException;
import com.taskflow.backend.modules.auth.domain.TaskPrincipal;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * In-memory registry of live sessions. Sessions are not persisted; ending one only
 * removes it from this map, after which the principal is rejected by every operation.
 */
@Component
public class PrincipalSessionRegistry {

    static final String CODE_UNAUTHENTICATED = "UNAUTHENTICATED";

    private final Map<UUID, UUID> userIdBySession = new ConcurrentHashMap<>();

    public void register(TaskPrincipal principal) {
        userIdBySession.put(principal.sessionId(), principal.userId());
    }

    public boolean revoke(TaskPrincipal principal) {
        if (principal == null || principal.sessionId() == null) {
            return false;
        }
        return userIdBySession.remove(principal.sessionId()) != null;
    }

    public boolean isActive(TaskPrincipal principal) {
        if (principal == null || principal.sessionId() == null) {
            return false;
        }
        UUID owner = userIdBySession.get(principal.sessionId());
        return owner != null && owner.equals(principal.userId());
    }

    public TaskPrincipal requireActive(TaskPrincipal principal) {
        if (!isActive(principal)) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, CODE_UNAUTHENTICATED, "an active session is required");
        }
        return principal;
    }

    public int activeSessionCount() {
        return userIdBySession.size();
    }
}
