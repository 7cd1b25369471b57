package org.ergs.fixie.api;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.util.List;
import java.util.regex.Pattern;

/**
 * JSON bodies accepted by {@link PathsResource}. Every request carries the
 * caller's {@code user} and {@code token}.
 */
public final class PathRequests {

    private static final Pattern TOKEN = Pattern.compile("[0-9a-fA-F]+");

    private PathRequests() {
    }

    public interface Authenticated {
        String user();

        String token();
    }

    public record ListPaths(String user, String token, String pattern) implements Authenticated {}

    public record Info(
            String user,
            String token,
            @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
            List<String> paths,
            String pattern
    ) implements Authenticated {}

    public record Fetch(String user, String token, String path, Boolean url) implements Authenticated {}

    public record Delete(String user, String token, String path) implements Authenticated {}

    public record ReadTable(
            String user,
            String token,
            String path,
            String table,
            List<List<Object>> conds,
            String format,
            String orient
    ) implements Authenticated {}

    public record Gc(String user, String token) implements Authenticated {}

    /**
     * Checks the fields every request needs.
     *
     * @throws InvalidRequestException if the body, user or token is missing or malformed
     */
    static <R extends Authenticated> R checkCredentials(R request) {
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }
        if (request.user() == null || request.user().isEmpty()) {
            throw new InvalidRequestException("user is required and cannot be empty");
        }
        if (request.token() == null || !TOKEN.matcher(request.token()).matches()) {
            throw new InvalidRequestException("token is required and must be hexadecimal");
        }
        return request;
    }

    /** @throws InvalidRequestException if {@code value} is null or empty */
    static String required(String name, String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidRequestException(name + " is required and cannot be empty");
        }
        return value;
    }
}
