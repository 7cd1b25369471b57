package org.ergs.fixie.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.ergs.fixie.core.gc.PathSweeper;
import org.ergs.fixie.core.paths.FetchedFile;
import org.ergs.fixie.core.paths.Outcome;
import org.ergs.fixie.core.paths.PathService;
import org.ergs.fixie.core.storage.ArtifactException;
import org.ergs.fixie.core.storage.ArtifactStorage;
import org.ergs.fixie.core.table.Condition;
import org.ergs.fixie.core.table.TableFormat;
import org.ergs.fixie.core.table.TableOrient;
import org.ergs.fixie.core.table.TableService;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.ergs.fixie.api.PathRequests.checkCredentials;
import static org.ergs.fixie.api.PathRequests.required;

/**
 * Registry operations over HTTP. Responses carry the operation's payload
 * under its own key next to {@code status} and {@code message}; an
 * unsuccessful operation is still a 200 with {@code status: false}.
 */
@Path("/")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class PathsResource {

    private static final Logger log = Logger.getLogger(PathsResource.class);

    @Inject
    PathService pathService;

    @Inject
    TableService tableService;

    @Inject
    PathSweeper sweeper;

    @Inject
    ArtifactStorage artifacts;

    @Inject
    UserVerifier userVerifier;

    @POST
    @Path("/listpaths")
    public Map<String, Object> listPaths(PathRequests.ListPaths request) {
        verify(request);
        return envelope("paths", pathService.listPaths(request.user(), request.pattern()));
    }

    @POST
    @Path("/info")
    public Map<String, Object> info(PathRequests.Info request) {
        verify(request);
        if (request.paths() != null) {
            if (request.paths().isEmpty()) {
                throw new InvalidRequestException("paths cannot be empty");
            }
            request.paths().forEach(p -> required("paths entry", p));
        }
        if (request.paths() != null && request.pattern() != null) {
            throw new InvalidRequestException("paths and pattern are mutually exclusive");
        }
        return envelope("infos", pathService.info(request.user(), request.paths(), request.pattern()));
    }

    @POST
    @Path("/fetch")
    public Map<String, Object> fetch(PathRequests.Fetch request) {
        verify(request);
        required("path", request.path());
        boolean asReference = Boolean.TRUE.equals(request.url());
        Outcome<FetchedFile> fetched = pathService.fetch(request.user(), request.path(), asReference);
        Outcome<Object> file = fetched.map(PathsResource::payload, fetched.message());
        return envelope("file", file);
    }

    /** Streams an artifact named by a locator returned from a reference fetch. */
    @GET
    @Path("/fetch")
    @Produces(MediaType.APPLICATION_OCTET_STREAM)
    public Response download(@QueryParam("file") List<String> files) {
        if (files == null || files.size() != 1) {
            throw new InvalidRequestException("Exactly one file may be fetched!");
        }
        java.nio.file.Path artifact;
        try {
            artifact = artifacts.resolveReference(files.get(0));
        } catch (ArtifactException e) {
            throw new InvalidRequestException(e.getMessage());
        }
        if (!artifacts.exists(artifact)) {
            throw new InvalidRequestException("File not found");
        }
        log.debugf("Streaming %s", artifact);
        return Response.ok(artifact.toFile(), MediaType.APPLICATION_OCTET_STREAM_TYPE).build();
    }

    @POST
    @Path("/delete")
    public Map<String, Object> delete(PathRequests.Delete request) {
        verify(request);
        required("path", request.path());
        return envelope(null, pathService.delete(request.user(), request.path()));
    }

    @POST
    @Path("/table")
    public Map<String, Object> table(PathRequests.ReadTable request) {
        verify(request);
        required("path", request.path());
        required("table", request.table());
        List<Condition> conditions = new ArrayList<>();
        TableFormat format;
        TableOrient orient;
        try {
            if (request.conds() != null) {
                for (List<Object> cond : request.conds()) {
                    conditions.add(Condition.of(cond));
                }
            }
            format = TableFormat.fromName(request.format());
            orient = TableOrient.fromName(request.orient());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage());
        }
        return envelope("table", tableService.table(
                request.user(), request.path(), request.table(), conditions, format, orient));
    }

    @POST
    @Path("/gc")
    public Map<String, Object> gc(PathRequests.Gc request) {
        verify(request);
        log.infof("Garbage collection requested by %s", request.user());
        return envelope(null, sweeper.gc());
    }

    private void verify(PathRequests.Authenticated request) {
        checkCredentials(request);
        if (!userVerifier.verify(request.user(), request.token())) {
            throw new InvalidRequestException(Response.Status.UNAUTHORIZED,
                    "User " + request.user() + " could not be verified");
        }
    }

    private static Object payload(FetchedFile file) {
        if (file instanceof FetchedFile.Content content) {
            return content.bytes();
        }
        return ((FetchedFile.Reference) file).locator();
    }

    /** Response body; {@code key} is null for operations without a payload. */
    static Map<String, Object> envelope(String key, Outcome<?> outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (key != null) {
            body.put(key, outcome.value());
        }
        body.put("status", outcome.ok());
        body.put("message", outcome.message());
        return body;
    }
}
