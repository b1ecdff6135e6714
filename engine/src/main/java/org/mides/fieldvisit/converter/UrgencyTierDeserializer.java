package org.mides.fieldvisit.converter;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import org.mides.fieldvisit.model.UrgencyTier;

import java.io.IOException;
import java.util.Locale;

public class UrgencyTierDeserializer extends JsonDeserializer<UrgencyTier> {

    @Override
    public UrgencyTier deserialize(JsonParser p, DeserializationContext context) throws IOException {
        String tier = p.getText();
        try {
            return UrgencyTier.valueOf(tier.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw context.weirdStringException(tier, UrgencyTier.class, "unknown urgency tier");
        }
    }
}
