package com.codeheadsystems.otp.server.model;

import com.codeheadsystems.otp.rfc.hotp.Counter;

/**
 * A successful authentication.
 *
 * @param principal the principal identifier
 * @param steps     how many steps past the drift-adjusted counter the code matched
 * @param counter   the counter the code matched, now recorded as used
 */
public record AuthenticationResult(String principal, int steps, Counter counter) {
}
