package org.mides.fieldvisit.converter;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import org.mides.fieldvisit.model.CustomerTier;

import java.io.IOException;
import java.util.Locale;

public class CustomerTierDeserializer extends JsonDeserializer<CustomerTier> {

    @Override
    public CustomerTier deserialize(JsonParser p, DeserializationContext context) throws IOException {
        String tier = p.getText();
        try {
            return CustomerTier.valueOf(tier.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw context.weirdStringException(tier, CustomerTier.class, "unknown customer tier");
        }
    }
}
