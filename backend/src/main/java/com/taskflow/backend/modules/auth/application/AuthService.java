package com.taskflow.backend.modules.auth.application;

import java.util.UUID;

import com.taskflow.backend.global.error.PersistenceFailures;
import com.taskflow.backend.global.error.ProblemException;
import com.taskflow.backend.modules.auth.domain.TaskPrincipal;
import com.taskflow.backend.modules.auth.domain.TaskUser;
import com.taskflow.backend.modules.auth.infrastructure.persistence.TaskUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final int USERNAME_MAX_LENGTH = 50;

    private final TaskUserRepository taskUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final PrincipalSessionRegistry sessionRegistry;

    public AuthService(
            TaskUserRepository taskUserRepository,
            PasswordEncoder passwordEncoder,
            PrincipalSessionRegistry sessionRegistry
    ) {
        this.taskUserRepository = taskUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.sessionRegistry = sessionRegistry;
    }

    public UUID registerPrincipal(String username, String secret, String displayName, boolean admin, String email) {
        String normalizedUsername = normalizeUsername(username);
        if (!StringUtils.hasText(secret)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "SECRET_REQUIRED");
        }
        if (!StringUtils.hasText(displayName)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "DISPLAY_NAME_REQUIRED");
        }
        if (taskUserRepository.existsByUsernameIgnoreCase(normalizedUsername)) {
            throw new ProblemException(HttpStatus.CONFLICT, "USERNAME_TAKEN", "username already exists: " + normalizedUsername);
        }

        TaskUser user = new TaskUser();
        user.setUsername(normalizedUsername);
        user.setPasswordHash(passwordEncoder.encode(secret));
        user.setDisplayName(displayName.trim());
        user.setAdmin(admin);
        user.setEmail(StringUtils.hasText(email) ? email.trim() : null);

        try {
            TaskUser saved = taskUserRepository.saveAndFlush(user);
            log.info("Registered user {} (admin={})", saved.getUsername(), saved.isAdmin());
            return saved.getId();
        } catch (DataIntegrityViolationException ex) {
            // a concurrent registration won the unique index on lower(username)
            throw new ProblemException(HttpStatus.CONFLICT, "USERNAME_TAKEN", "username already exists: " + normalizedUsername);
        } catch (DataAccessException ex) {
            throw PersistenceFailures.translate(ex);
        }
    }

    @Transactional(readOnly = true)
    public TaskPrincipal authenticate(String username, String secret) {
        if (!StringUtils.hasText(username) || secret == null) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }
        TaskUser user = taskUserRepository.findByUsernameIgnoreCase(username.trim())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));

        if (!passwordEncoder.matches(secret, user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }

        TaskPrincipal principal = TaskPrincipal.of(UUID.randomUUID(), user);
        sessionRegistry.register(principal);
        log.info("Session opened for {}", user.getUsername());
        return principal;
    }

    public void endSession(TaskPrincipal principal) {
        if (sessionRegistry.revoke(principal)) {
            log.info("Session closed for {}", principal.username());
        }
    }

    public TaskPrincipal updateNotificationPreferences(TaskPrincipal principal, boolean emailEnabled, boolean inAppEnabled) {
        sessionRegistry.requireActive(principal);
        TaskUser user = taskUserRepository.findById(principal.userId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        user.setEmailNotificationsEnabled(emailEnabled);
        user.setInAppNotificationsEnabled(inAppEnabled);
        try {
            taskUserRepository.saveAndFlush(user);
        } catch (DataAccessException ex) {
            throw PersistenceFailures.translate(ex);
        }
        return TaskPrincipal.of(principal.sessionId(), user);
    }

    private String normalizeUsername(String rawUsername) {
        if (!StringUtils.hasText(rawUsername)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "USERNAME_REQUIRED");
        }
        String trimmed = rawUsername.trim();
        if (trimmed.length() > USERNAME_MAX_LENGTH) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "USERNAME_TOO_LONG",
                    "username must be at most " + USERNAME_MAX_LENGTH + " characters");
        }
        return trimmed;
    }
}
