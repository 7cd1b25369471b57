package org.ergs.fixie.api;

/**
 * Checks that a token belongs to a user. Every registry request passes
 * through it after its fields have been validated.
 */
public interface UserVerifier {

    boolean verify(String user, String token);
}
