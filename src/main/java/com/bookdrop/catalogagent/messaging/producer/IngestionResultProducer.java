package com.bookdrop.catalogagent.messaging.producer;

import com.bookdrop.catalogagent.messaging.producer.dto.IngestionResultDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionResultProducer {

    private final KafkaTemplate<String, IngestionResultDto> kafkaTemplate;
    private static final String TOPIC = "ingest-book-results";

    public void send(IngestionResultDto message) {
        log.info("Sending ingestion result to Kafka: requestId={}, success={}, plans={}",
                message.requestId(), message.success(), message.plans().size());

        kafkaTemplate.send(TOPIC, message.requestId(), message);
    }
}
