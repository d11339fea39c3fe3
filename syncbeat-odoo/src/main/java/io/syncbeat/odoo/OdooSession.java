package io.syncbeat.odoo;

/**
 * An authenticated Odoo session: the user id used in {@code execute_kw} and the {@code session_id} cookie.
 */
public record OdooSession(long uid, String sessionId) {
}
