package org.mides.fieldvisit.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteStopRequest {

    @NotNull
    @JsonProperty("arrived_at")
    private Instant arrivedAt;

    @NotNull
    @JsonProperty("started_at")
    private Instant startedAt;

    @NotNull
    @JsonProperty("completed_at")
    private Instant completedAt;

    @JsonProperty("items_removed")
    private int itemsRemoved;

    @JsonProperty("items_installed")
    private int itemsInstalled;

    @Size(max = 500)
    @JsonProperty("issues")
    private String issues;

    @Size(max = 500)
    @JsonProperty("customer_feedback")
    private String customerFeedback;

    @JsonProperty("photo_urls")
    @Builder.Default
    private List<String> photoUrls = new ArrayList<>();

    @Valid
    @JsonProperty("photos")
    @Builder.Default
    private List<PhotoUpload> photos = new ArrayList<>();
}
