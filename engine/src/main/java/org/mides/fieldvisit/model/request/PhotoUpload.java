package org.mides.fieldvisit.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PhotoUpload {

    @JsonProperty("filename")
    private String filename;

    /* Base64 in JSON */
    @NotEmpty
    @JsonProperty("content")
    private byte[] content;
}
