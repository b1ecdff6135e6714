package org.mides.fieldvisit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.fieldvisit.converter.DurationDeserializer;
import org.mides.fieldvisit.converter.DurationSerializer;

import java.time.Duration;

/**
 * One visit within a schedule.
 * {@code completion} is set only when COMPLETED and {@code skipReason} only when CANCELLED.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Stop {

    @JsonProperty("id")
    private String id;

    @JsonProperty("schedule_id")
    private String scheduleId;

    @JsonProperty("service_request_id")
    private String serviceRequestId;

    @JsonProperty("customer_id")
    private String customerId;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("address")
    private String address;

    @JsonProperty("location")
    private GeoPoint location;

    @Min(1)
    @JsonProperty("estimated_duration_minutes")
    @Builder.Default
    private int estimatedDurationMinutes = 30;

    @JsonProperty("quantity")
    private int quantity;

    @JsonProperty("stop_order")
    private int stopOrder;

    @JsonProperty("status")
    @Builder.Default
    private StopStatus status = StopStatus.PENDING;

    @JsonProperty("planned_arrival")
    @JsonSerialize(using = DurationSerializer.class)
    @JsonDeserialize(using = DurationDeserializer.class)
    private Duration plannedArrival;

    @JsonProperty("eta")
    @JsonSerialize(using = DurationSerializer.class)
    @JsonDeserialize(using = DurationDeserializer.class)
    private Duration eta;

    @JsonProperty("completion")
    private StopCompletion completion;

    @JsonProperty("skip_reason")
    private String skipReason;

    @JsonProperty("skipped_by")
    private String skippedBy;

    public Stop copy() {
        return toBuilder().build();
    }
}
