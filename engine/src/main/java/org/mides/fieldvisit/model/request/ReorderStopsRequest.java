package org.mides.fieldvisit.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class ReorderStopsRequest {

    @NotEmpty
    @JsonProperty("stop_ids")
    private List<String> stopIds = new ArrayList<>();
}
