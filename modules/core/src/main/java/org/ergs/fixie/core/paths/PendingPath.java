package org.ergs.fixie.core.paths;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/**
 * A registration descriptor not yet merged into its user's registry.
 * The creation time is stamped from the artifact during reconciliation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingPath(
        String path,
        String file,
        String user,
        String jobid,
        @JsonSerialize(using = HoldingJson.Serializer.class)
        @JsonDeserialize(using = HoldingJson.Deserializer.class)
        Double holding
) {

    public PathEntry toEntry(double created) {
        return new PathEntry(path, file, user, jobid, created, holding);
    }
}
