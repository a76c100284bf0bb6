package com.deeplog.deeplog.context;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Issues the per-session client context id that scopes a recent-timers cache, and the CSRF
 * token that guards mutating calls.
 */
@Service
public class ClientContextService {

    public static final String SESSION_CONTEXT_ID = "session_client_context_id";
    public static final String CSRF_HEADER = "X-CSRF-Token";

    private static final String SESSION_CSRF_TOKEN = "session_csrf_token";

    private final SecureRandom secureRandom = new SecureRandom();

    public String getOrCreateContextId(HttpSession session) {
        return getOrCreate(session, SESSION_CONTEXT_ID, 18);
    }

    public String getOrCreateToken(HttpSession session) {
        return getOrCreate(session, SESSION_CSRF_TOKEN, 24);
    }

    public void requireValidToken(HttpServletRequest request, HttpSession session) {
        String expected = getOrCreateToken(session);
        String actual = request.getHeader(CSRF_HEADER);
        if (actual == null || actual.isBlank() || !expected.equals(actual)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Invalid CSRF token");
        }
    }

    public static String contextIdOf(HttpSession session) {
        return session.getAttribute(SESSION_CONTEXT_ID) instanceof String id ? id : null;
    }

    private String getOrCreate(HttpSession session, String attribute, int byteLength) {
        Object existing = session.getAttribute(attribute);
        if (existing instanceof String value && !value.isBlank()) {
            return value;
        }
        byte[] bytes = new byte[byteLength];
        secureRandom.nextBytes(bytes);
        String value = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        session.setAttribute(attribute, value);
        return value;
    }
}
