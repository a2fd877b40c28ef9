package com.bookdrop.catalogagent.messaging.consumer;

import com.bookdrop.catalogagent.domain.model.IngestionPlan;
import com.bookdrop.catalogagent.domain.model.ProcessingStatus;
import com.bookdrop.catalogagent.domain.service.BookIngestionService;
import com.bookdrop.catalogagent.messaging.consumer.dto.IngestBooksTaskDto;
import com.bookdrop.catalogagent.messaging.producer.IngestionResultProducer;
import com.bookdrop.catalogagent.messaging.producer.dto.IngestionResultDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
public class IngestBooksListener {

    private final BookIngestionService ingestionService;
    private final IngestionResultProducer resultProducer;

    @KafkaListener(topics = "ingest-book-tasks", groupId = "catalog-agent-group")
    public void handleIngestBooks(IngestBooksTaskDto task) {
        List<String> fileNames = task.fileNames() == null ? List.of() : task.fileNames();
        log.info("Received ingest task: requestId={}, files={}", task.requestId(), fileNames.size());

        try {
            List<IngestionPlan> plans = ingestionService.planBatch(fileNames);

            List<String> errors = plans.stream()
                    .filter(plan -> plan.status() == ProcessingStatus.FAILED)
                    .map(IngestionPlan::message)
                    .toList();

            IngestionResultDto resultDto = new IngestionResultDto(
                    task.requestId(),
                    plans,
                    errors.isEmpty(),
                    "Planned " + plans.size() + " files",
                    errors
            );

            resultProducer.send(resultDto);

        } catch (Exception ex) {
            log.error("Fatal error processing ingest task: {}", ex.getMessage(), ex);

            IngestionResultDto errorDto = new IngestionResultDto(
                    task.requestId(),
                    List.of(),
                    false,
                    "Fatal error: " + ex.getMessage(),
                    List.of(String.valueOf(ex.getMessage()))
            );

            resultProducer.send(errorDto);
        }
    }
}
