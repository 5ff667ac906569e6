package com.pipeline.amts.sinks;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pipeline.amts.core.OutputSink;
import com.pipeline.amts.model.DeltaRecord;
import com.pipeline.amts.model.ProcessingMode;
import com.pipeline.amts.model.SliceDefinition;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * 位移记录的Kafka推送。
 * 每条新写入的记录以JSON发送到指定Topic，消息键为 sliceId。
 *
 * 消息格式：
 * {"sliceId":"S1:P01","site":"S1","mode":"INCREMENTAL","timestamp":"2024-03-01T00:00:00Z",
 *  "sensorId":"101","pointName":"P01","deltaNorthMm":1.2,"deltaEastMm":-0.4,"deltaHeightMm":3.0,"outlier":false}
 */
public class KafkaDeltaPublisher implements OutputSink {

    private static final Logger log = LoggerFactory.getLogger(KafkaDeltaPublisher.class);

    private final Producer<String, String> producer;
    private final String topic;
    private final ObjectMapper mapper;

    public KafkaDeltaPublisher(Producer<String, String> producer, String topic) {
        this.producer = producer;
        this.topic = topic;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * 按连接地址创建发布者。
     */
    public static KafkaDeltaPublisher create(String bootstrapServers, String topic) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        props.put(ProducerConfig.LINGER_MS_CONFIG, "20");

        log.info("KafkaDeltaPublisher connecting. Servers: {}, Topic: {}", bootstrapServers, topic);
        return new KafkaDeltaPublisher(new KafkaProducer<>(props), topic);
    }

    @Override
    public String name() {
        return "kafka:" + topic;
    }

    @Override
    public void accept(SliceDefinition definition, List<DeltaRecord> records, ProcessingMode mode) throws Exception {
        String sliceId = definition.getSliceId();
        List<Future<RecordMetadata>> sends = new ArrayList<>(records.size());
        for (DeltaRecord record : records) {
            sends.add(producer.send(new ProducerRecord<>(topic, sliceId, toJson(definition, record, mode))));
        }
        producer.flush();

        for (Future<RecordMetadata> send : sends) {
            try {
                send.get();
            } catch (ExecutionException e) {
                throw new IllegalStateException("Publish to topic '" + topic + "' failed for slice '"
                        + sliceId + "': " + e.getCause().getMessage(), e.getCause());
            }
        }
        log.debug("Published {} record(s) for slice '{}' to '{}'.", records.size(), sliceId, topic);
    }

    String toJson(SliceDefinition definition, DeltaRecord record, ProcessingMode mode) throws Exception {
        ObjectNode node = mapper.createObjectNode();
        node.put("sliceId", definition.getSliceId());
        node.put("site", definition.getSite());
        node.put("mode", mode.name());
        node.setAll((ObjectNode) mapper.valueToTree(record));
        return mapper.writeValueAsString(node);
    }

    @Override
    public void close() {
        producer.close();
        log.info("KafkaDeltaPublisher closed.");
    }
}
