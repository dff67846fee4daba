package me.golemcore.hrms.adapter.inbound.web;

import me.golemcore.hrms.domain.model.CallerIdentity;
import me.golemcore.hrms.domain.model.UserRole;

/**
 * Caller identity headers set by the authenticating gateway in front of this
 * service.
 */
public final class CallerHeaders {

    public static final String CALLER_ID = "X-Caller-Id";
    public static final String CALLER_ROLE = "X-Caller-Role";
    public static final String CALLER_NAME = "X-Caller-Name";
    public static final String CALLER_EMP_CODE = "X-Caller-Emp-Code";

    private CallerHeaders() {
    }

    /**
     * Builds the caller identity for a turn. The session id defaults to the
     * caller id.
     *
     * @throws IllegalArgumentException
     *             when the id is missing or the role is unknown
     */
    public static CallerIdentity toIdentity(String callerId, String role, String name, String empCode,
            String sessionId) {
        if (callerId == null || callerId.isBlank()) {
            throw new IllegalArgumentException("Missing " + CALLER_ID + " header");
        }
        UserRole userRole = UserRole.fromValue(role)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + role));
        return CallerIdentity.builder()
                .id(callerId)
                .role(userRole)
                .name(name)
                .empCode(empCode)
                .sessionId(sessionId != null && !sessionId.isBlank() ? sessionId : callerId)
                .build();
    }
}
