package com.outbreaksentinel.flink;

import com.outbreaksentinel.core.notify.DeliveryResult;
import com.outbreaksentinel.core.notify.NotificationChannel;
import com.outbreaksentinel.core.notify.NotificationRequest;
import com.outbreaksentinel.core.notify.Recipient;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes notifications to a Kafka topic, keyed by alert id, with the
 * recipient address in the {@code recipient} header.
 *
 * <h3>Classification</h3>
 * <ul>
 * <li>acknowledged by the broker: sent</li>
 * <li>retriable Kafka error or no acknowledgement in time: transient</li>
 * <li>any other error: rejected</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class KafkaNotificationChannel implements NotificationChannel, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaNotificationChannel.class);

    public static final String NAME = "kafka";

    private final Producer<String, NotificationRequest> producer;
    private final String topic;
    private final Duration timeout;

    public KafkaNotificationChannel(JobConfig config) {
        this(new KafkaProducer<>(config.kafkaProducerProperties(), new StringSerializer(),
                        new NotificationRequestSerializer()),
                config.getKafkaNotificationTopic(),
                Duration.ofMillis(config.getNotificationTimeoutMs()));
    }

    KafkaNotificationChannel(Producer<String, NotificationRequest> producer, String topic, Duration timeout) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DeliveryResult deliver(NotificationRequest request, Recipient recipient) {
        ProducerRecord<String, NotificationRequest> record = new ProducerRecord<>(topic, request.getAlertId(), request);
        record.headers().add("recipient", recipient.getAddress().getBytes(StandardCharsets.UTF_8));
        try {
            producer.send(record).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return DeliveryResult.sent(recipient);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RetriableException) {
                LOG.warn("Retriable Kafka error for alert {}: {}", request.getAlertId(), cause.getMessage());
                return DeliveryResult.transientFailure(recipient, cause.getClass().getSimpleName());
            }
            LOG.error("Kafka rejected notification for alert {}", request.getAlertId(), cause);
            return DeliveryResult.rejected(recipient, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (TimeoutException e) {
            LOG.warn("No Kafka acknowledgement for alert {} within {} ms", request.getAlertId(), timeout.toMillis());
            return DeliveryResult.transientFailure(recipient, "timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.transientFailure(recipient, "interrupted");
        } catch (KafkaException e) {
            // thrown synchronously by send(), e.g. serialization or metadata timeout
            if (e instanceof RetriableException) {
                return DeliveryResult.transientFailure(recipient, e.getClass().getSimpleName());
            }
            LOG.error("Kafka refused notification for alert {}", request.getAlertId(), e);
            return DeliveryResult.rejected(recipient, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    public void close() {
        producer.close(timeout);
    }
}
