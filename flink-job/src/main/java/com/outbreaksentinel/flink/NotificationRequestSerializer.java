package com.outbreaksentinel.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.outbreaksentinel.core.notify.NotificationRequest;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;

/**
 * Kafka {@link Serializer} that converts {@link NotificationRequest} → JSON
 * bytes for the notification topic.
 */
public class NotificationRequestSerializer implements Serializer<NotificationRequest> {

    private ObjectMapper mapper;

    @Override
    public byte[] serialize(String topic, NotificationRequest request) {
        if (request == null) {
            return null;
        }
        try {
            return objectMapper().writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize notification for alert "
                    + request.getAlertId(), e);
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
