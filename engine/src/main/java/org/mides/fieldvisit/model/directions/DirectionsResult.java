package org.mides.fieldvisit.model.directions;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Provider-neutral answer of a directions query.
 * {@code orderedWaypointIndices[k]} is the index, in the request's waypoint list,
 * of the waypoint visited k-th.
 */
@Data
@NoArgsConstructor
public class DirectionsResult {
    public static final String STATUS_OK = "OK";

    private String status;
    private List<Integer> orderedWaypointIndices = new ArrayList<>();
    private List<DirectionsLeg> legs = new ArrayList<>();
    private String encodedPolyline;

    public boolean isSuccess() {
        return Objects.equals(status, STATUS_OK);
    }

    /**
     * Decodes the encoded polyline (precision 1e5) into {@code [longitude, latitude]} pairs.
     */
    public List<List<Double>> decodePolyline() {
        if (encodedPolyline == null || encodedPolyline.isEmpty()) {
            throw new IllegalArgumentException("encodedPolyline");
        }

        char[] polylineChars = encodedPolyline.toCharArray();
        int index = 0;

        int currentLat = 0;
        int currentLng = 0;

        List<List<Double>> result = new ArrayList<>();

        while (index < polylineChars.length) {
            int[] latitude = decodeValue(polylineChars, index);
            if (latitude == null) {
                break;
            }
            index = latitude[1];
            currentLat += latitude[0];

            int[] longitude = decodeValue(polylineChars, index);
            if (longitude == null) {
                break;
            }
            index = longitude[1];
            currentLng += longitude[0];

            List<Double> point = new ArrayList<>();
            point.add((double) currentLng / 1E5);
            point.add((double) currentLat / 1E5);
            result.add(point);
        }

        return result;
    }

    /* Returns {delta, nextIndex}, or null when the input ends mid-value */
    private static int[] decodeValue(char[] chars, int index) {
        int sum = 0;
        int shifter = 0;
        int nextFiveBits;
        do {
            if (index >= chars.length) {
                return null;
            }
            nextFiveBits = chars[index++] - 63;
            sum |= (nextFiveBits & 31) << shifter;
            shifter += 5;
        } while (nextFiveBits >= 32);

        int delta = (sum & 1) == 1 ? ~(sum >> 1) : (sum >> 1);
        return new int[]{delta, index};
    }
}
