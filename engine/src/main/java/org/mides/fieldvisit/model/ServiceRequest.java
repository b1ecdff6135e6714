package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.fieldvisit.converter.CustomerTierDeserializer;
import org.mides.fieldvisit.converter.UrgencyTierDeserializer;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A customer's pending exchange or service need.
 * Urgency and quantity are frozen once the request is scheduled.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ServiceRequest {

    @JsonProperty("id")
    private String id;

    @NotBlank
    @JsonProperty("customer_id")
    private String customerId;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("address")
    private String address;

    @Valid
    @JsonProperty("location")
    private GeoPoint location;

    @NotNull
    @JsonProperty("urgency")
    @JsonDeserialize(using = UrgencyTierDeserializer.class)
    private UrgencyTier urgency;

    @JsonProperty("customer_tier")
    @JsonDeserialize(using = CustomerTierDeserializer.class)
    @Builder.Default
    private CustomerTier customerTier = CustomerTier.STANDARD;

    @Min(1)
    @JsonProperty("quantity")
    private int quantity;

    @Size(max = 1000)
    @JsonProperty("reason")
    private String reason;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("preferred_date")
    private LocalDate preferredDate;

    @Min(1)
    @JsonProperty("estimated_duration_minutes")
    @Builder.Default
    private int estimatedDurationMinutes = 30;

    @JsonProperty("status")
    @Builder.Default
    private RequestStatus status = RequestStatus.PENDING;
}
