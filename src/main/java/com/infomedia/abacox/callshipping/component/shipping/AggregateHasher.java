package com.infomedia.abacox.callshipping.component.shipping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.infomedia.abacox.callshipping.component.aggregation.CallAggregate;
import com.infomedia.abacox.callshipping.component.utils.XXHash64Util;
import org.springframework.stereotype.Component;

/**
 * Content hash of an aggregate. Shipping metadata and raw records are left out so only a change
 * in the call itself changes the hash.
 */
@Component
public class AggregateHasher {

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .build();

    public String hash(CallAggregate aggregate) {
        CallAggregate content = aggregate.toBuilder()
                .shippingPhase(null)
                .complete(false)
                .shippedAt(null)
                .tenantSource(null)
                .rawCdrs(null)
                .rawCels(null)
                .build();
        try {
            return XXHash64Util.toHex(objectMapper.writeValueAsBytes(content));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize aggregate " + aggregate.getLinkedId(), e);
        }
    }
}
