package org.ergs.fixie.api;

import org.ergs.fixie.core.paths.Outcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PathsResourceEnvelopeTest {

    // --- envelope ---

    @Test
    void successCarriesPayloadUnderItsKey() {
        assertThat(PathsResource.envelope("paths", Outcome.success(List.of("/as"), "Paths listed")))
                .containsExactly(
                        entry("paths", List.of("/as")),
                        entry("status", true),
                        entry("message", "Paths listed"));
    }

    @Test
    void failureKeepsTheKeyWithNullPayload() {
        assertThat(PathsResource.envelope("infos", Outcome.failure("nope")))
                .containsEntry("infos", null)
                .containsEntry("status", false)
                .containsEntry("message", "nope");
    }

    @Test
    void operationsWithoutPayloadHaveOnlyStatusAndMessage() {
        assertThat(PathsResource.envelope(null, Outcome.success(null, "Path deleted")))
                .containsOnlyKeys("status", "message");
    }

    // --- credentials ---

    @Test
    void acceptsHexTokens() {
        var request = new PathRequests.ListPaths("inigo", "42aF", null);

        assertThat(PathRequests.checkCredentials(request)).isSameAs(request);
    }

    @Test
    void rejectsMissingUserOrBadToken() {
        assertThatThrownBy(() -> PathRequests.checkCredentials(new PathRequests.ListPaths("", "42", null)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("user");
        assertThatThrownBy(() -> PathRequests.checkCredentials(new PathRequests.ListPaths("inigo", "xyz", null)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("token");
        assertThatThrownBy(() -> PathRequests.checkCredentials(new PathRequests.Gc("inigo", null)))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> PathRequests.checkCredentials(null))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void requiredFieldsCannotBeEmpty() {
        assertThat(PathRequests.required("path", "/as")).isEqualTo("/as");
        assertThatThrownBy(() -> PathRequests.required("path", ""))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("path is required and cannot be empty");
    }
}
