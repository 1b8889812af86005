package com.parish.governance.api.dto;

/**
 * @param stopped true if this call ended the session, false if it had already ended
 */
public record StopImpersonationResponse(boolean stopped) {
}
