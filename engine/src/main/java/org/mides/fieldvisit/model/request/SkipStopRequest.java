package org.mides.fieldvisit.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SkipStopRequest {

    /* Length rules are enforced by the engine so they carry the SKIP_REASON_TOO_SHORT code */
    @JsonProperty("reason")
    private String reason;
}
