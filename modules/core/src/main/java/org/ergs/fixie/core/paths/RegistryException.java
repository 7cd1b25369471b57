package org.ergs.fixie.core.paths;

/**
 * Registry or pending-record content that could not be read, parsed or written.
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }

    public RegistryException(String message) {
        super(message);
    }
}
