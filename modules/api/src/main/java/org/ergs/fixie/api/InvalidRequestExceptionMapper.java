package org.ergs.fixie.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

@Provider
public class InvalidRequestExceptionMapper implements ExceptionMapper<InvalidRequestException> {

    private static final Logger log = Logger.getLogger(InvalidRequestExceptionMapper.class);

    @Override
    public Response toResponse(InvalidRequestException e) {
        log.debugf("Rejected request (%d): %s", e.status().getStatusCode(), e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", false);
        body.put("message", e.getMessage());
        return Response.status(e.status())
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(body)
                .build();
    }
}
