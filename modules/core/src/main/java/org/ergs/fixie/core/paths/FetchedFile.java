package org.ergs.fixie.core.paths;

/**
 * Payload of a fetch: either the artifact bytes or a retrieval reference.
 */
public sealed interface FetchedFile {

    record Content(byte[] bytes) implements FetchedFile {}

    record Reference(String locator) implements FetchedFile {}
}
