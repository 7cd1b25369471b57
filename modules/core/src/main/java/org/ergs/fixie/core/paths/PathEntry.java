package org.ergs.fixie.core.paths;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.ergs.fixie.util.Holding;

import java.util.Objects;

/**
 * One path registration in a user's registry.
 *
 * @param path    logical key, unique within the registry
 * @param file    absolute location of the backing artifact (may be null for
 *                records written without one; such entries cannot be fetched)
 * @param user    owning user
 * @param jobid   job that produced the artifact
 * @param created artifact creation time, epoch seconds
 * @param holding retention in seconds; {@code +Infinity} never expires
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PathEntry(
        @JsonProperty(required = true)
        String path,
        String file,
        String user,
        String jobid,
        double created,
        @JsonProperty(required = true)
        @JsonSerialize(using = HoldingJson.Serializer.class)
        @JsonDeserialize(using = HoldingJson.Deserializer.class)
        double holding
) {

    public PathEntry {
        Objects.requireNonNull(path, "path cannot be null");
    }

    public boolean isExpired(double nowSeconds) {
        return Holding.isExpired(created, holding, nowSeconds);
    }
}
