package org.mides.fieldvisit.service;

import org.mides.fieldvisit.model.CustomerTier;
import org.mides.fieldvisit.model.PriorityLabel;
import org.mides.fieldvisit.model.ScoredRequest;
import org.mides.fieldvisit.model.ServiceRequest;
import org.mides.fieldvisit.model.UrgencyTier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Scores a request on a 0-100 scale:
 * urgency 5-40, customer tier 8-25, volume 0-15, age 0-10, keywords 0-10.
 */
@Service
public class PriorityScorer implements IPriorityScorer {

    private static final int POINTS_PER_ITEM = 3;
    private static final int MAX_VOLUME_POINTS = 15;
    private static final int MAX_AGE_POINTS = 10;
    private static final int KEYWORD_POINTS = 10;

    /* Complaint and urgency wording, with and without Vietnamese diacritics */
    private static final List<String> URGENT_KEYWORDS = List.of(
        "chết", "vàng lá", "vang la", "sâu bệnh", "sau benh",
        "gấp", "khẩn", "héo", "thối", "mục", "lập tức", "lap tuc",
        "dead", "dying", "wilted", "rotten", "pest", "urgent", "complaint", "asap"
    );

    @Override
    public int score(ServiceRequest request, Instant now) {
        int score = urgencyPoints(request.getUrgency())
            + tierPoints(request.getCustomerTier())
            + volumePoints(request.getQuantity())
            + agePoints(request.getCreatedAt(), now)
            + keywordPoints(request.getReason());

        return Math.max(MIN_SCORE, Math.min(score, MAX_SCORE));
    }

    @Override
    public List<ScoredRequest> rank(List<ServiceRequest> requests, Instant now) {
        return requests.stream()
            .map(request -> {
                int score = score(request, now);
                return new ScoredRequest(request, score, PriorityLabel.fromScore(score));
            })
            .sorted(Comparator.comparingInt(ScoredRequest::getScore).reversed()
                .thenComparing(scored -> scored.getRequest().getCreatedAt(),
                    Comparator.nullsLast(Comparator.<Instant>naturalOrder())))
            .toList();
    }

    private int urgencyPoints(UrgencyTier urgency) {
        return (urgency != null ? urgency : UrgencyTier.MEDIUM).getWeight();
    }

    private int tierPoints(CustomerTier tier) {
        return (tier != null ? tier : CustomerTier.STANDARD).getWeight();
    }

    private int volumePoints(int quantity) {
        return Math.min(Math.max(quantity, 0) * POINTS_PER_ITEM, MAX_VOLUME_POINTS);
    }

    private int agePoints(Instant createdAt, Instant now) {
        if (createdAt == null || now == null || createdAt.isAfter(now)) {
            return 0;
        }
        long days = Duration.between(createdAt, now).toDays();
        return (int) Math.min(days, MAX_AGE_POINTS);
    }

    private int keywordPoints(String reason) {
        if (reason == null || reason.isBlank()) {
            return 0;
        }
        var lower = reason.toLowerCase(Locale.ROOT);
        return URGENT_KEYWORDS.stream().anyMatch(lower::contains) ? KEYWORD_POINTS : 0;
    }
}
