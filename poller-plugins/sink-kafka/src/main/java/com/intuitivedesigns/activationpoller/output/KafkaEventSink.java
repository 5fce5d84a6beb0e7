/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.activationpoller.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.activationpoller.config.PollerConfig;
import com.intuitivedesigns.activationpoller.core.Event;
import com.intuitivedesigns.activationpoller.core.OutputSink;
import com.intuitivedesigns.activationpoller.core.PipelinePayload;
import com.intuitivedesigns.activationpoller.metrics.MetricsRuntime;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Publishes each event as a JSON record keyed by the payload id (the activation id for
 * activation events). Payload metadata travels as record headers.
 */
public final class KafkaEventSink implements OutputSink<Event> {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventSink.class);

    public static final String TOPIC = "sink.kafka.topic";
    public static final String SYNC = "sink.kafka.sync";
    public static final String DEFAULT_TOPIC = "openwhisk-activations";

    static final String M_SENT = "poller.kafka.send.ok";
    static final String M_FAILED = "poller.kafka.send.fail";

    private static final long ERROR_LOG_INTERVAL_MS = 1_000L;

    private final Producer<String, String> producer;
    private final String topic;
    private final boolean syncSend;
    private final ObjectMapper mapper;
    private final MetricsRuntime metrics;

    private final LongAdder sentOk = new LongAdder();
    private final LongAdder sentFail = new LongAdder();

    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrorLogs = new LongAdder();

    public KafkaEventSink(Producer<String, String> producer,
                          String topic,
                          boolean syncSend,
                          ObjectMapper mapper,
                          MetricsRuntime metrics) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.syncSend = syncSend;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.metrics = (metrics == null) ? MetricsRuntime.NOOP : metrics;

        log.info("KafkaEventSink active. topic='{}' sync={}", topic, syncSend);
    }

    public static KafkaEventSink fromConfig(PollerConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        String topic = config.getString(TOPIC, DEFAULT_TOPIC);
        boolean sync = config.getBoolean(SYNC, false);
        return new KafkaEventSink(new KafkaProducer<>(producerProps(config)), topic, sync, new ObjectMapper(), metrics);
    }

    static Properties producerProps(PollerConfig config) {
        Properties props = new Properties();

        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getString("kafka.bootstrap.servers", "localhost:9092"));
        props.put(ProducerConfig.CLIENT_ID_CONFIG, config.getString("kafka.producer.client.id", "activation-poller"));
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

        props.put(ProducerConfig.ACKS_CONFIG, config.getString("kafka.producer.acks", "all"));
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, config.getString("kafka.producer.compression", "lz4"));
        props.put(ProducerConfig.LINGER_MS_CONFIG, Integer.toString(config.getInt("kafka.producer.linger.ms", 5)));
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, Integer.toString(config.getInt("kafka.producer.batch.size", 65_536)));

        // kafka.ssl.*, kafka.security.*, kafka.sasl.* pass through with the "kafka." prefix stripped
        for (String key : config.keys()) {
            if (key.startsWith("kafka.ssl.") || key.startsWith("kafka.security.") || key.startsWith("kafka.sasl.")) {
                props.put(key.substring("kafka.".length()), config.getString(key, ""));
            }
        }
        return props;
    }

    @Override
    public void write(PipelinePayload<Event> payload) throws Exception {
        if (payload == null || payload.data() == null) return;

        String value = mapper.writeValueAsString(payload.data().toMap());
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, payload.id(), value);
        payload.metadata().forEach((k, v) -> record.headers().add(k, v.getBytes(StandardCharsets.UTF_8)));

        if (syncSend) {
            try {
                producer.send(record).get();
                markOk();
            } catch (Exception e) {
                markFail(e);
                throw e;
            }
        } else {
            producer.send(record, (metadata, exception) -> {
                if (exception == null) {
                    markOk();
                } else {
                    markFail(exception);
                }
            });
        }
    }

    @Override
    public void flush() {
        producer.flush();
    }

    public long sentOkTotal() {
        return sentOk.sum();
    }

    public long sentFailTotal() {
        return sentFail.sum();
    }

    @Override
    public void close() {
        log.info("Closing KafkaEventSink (topic={}, ok={}, failed={})...", topic, sentOk.sum(), sentFail.sum());
        try {
            producer.flush();
            producer.close(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("KafkaEventSink close failed", e);
        }
    }

    private void markOk() {
        sentOk.increment();
        metrics.counter(M_SENT);
    }

    private void markFail(Throwable exception) {
        sentFail.increment();
        metrics.counter(M_FAILED);

        long now = System.currentTimeMillis();
        long last = lastErrorLogMs.get();
        if (now - last >= ERROR_LOG_INTERVAL_MS && lastErrorLogMs.compareAndSet(last, now)) {
            long suppressed = suppressedErrorLogs.sumThenReset();
            log.error("Kafka write failed topic={} (suppressed {} similar errors): {}", topic, suppressed, exception.getMessage());
        } else {
            suppressedErrorLogs.increment();
        }
    }
}
