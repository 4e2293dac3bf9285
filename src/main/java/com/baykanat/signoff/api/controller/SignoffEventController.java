package com.baykanat.signoff.api.controller;

import com.baykanat.signoff.api.dto.BulkSignoffEventRequest;
import com.baykanat.signoff.api.dto.IngestionResponse;
import com.baykanat.signoff.api.dto.SignoffEventRequest;
import com.baykanat.signoff.infrastructure.kafka.SignoffEventKafkaProducer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** POST /signoff-events ve /signoff-events/bulk. Event Kafka'ya gider, 202 döner; event store'a yazım consumer'da. */
@Slf4j
@RestController
@RequestMapping("/signoff-events")
@RequiredArgsConstructor
@Tag(name = "Signoff Ingestion", description = "Endpoints for recording contract signoff attestations")
public class SignoffEventController {

    private final SignoffEventKafkaProducer kafkaProducer;

    @PostMapping
    @Operation(summary = "Record a signoff event", description = "Validates and queues a single signoff attestation")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Signoff event accepted for processing"),
            @ApiResponse(responseCode = "400", description = "Invalid signoff event payload"),
            @ApiResponse(responseCode = "503", description = "Ingestion temporarily unavailable (Kafka down)")
    })
    public ResponseEntity<IngestionResponse> ingestSignoffEvent(@Valid @RequestBody SignoffEventRequest event)
            throws Exception {
        log.debug("Received signoff event: booking_contract={}, dc_user_id={}",
                event.getBookingContract(), event.getDcUserId());

        kafkaProducer.send(event);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(IngestionResponse.builder()
                        .status("accepted")
                        .acceptedCount(1)
                        .message("Signoff event queued for processing")
                        .build());
    }

    /** En fazla 1000 event; biri bile geçersizse tüm istek 400. */
    @PostMapping("/bulk")
    @Operation(summary = "Record signoff events in bulk", description = "Accepts up to 1000 signoff attestations")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Signoff events accepted for processing"),
            @ApiResponse(responseCode = "400", description = "Invalid signoff event payload(s)"),
            @ApiResponse(responseCode = "503", description = "Ingestion temporarily unavailable")
    })
    public ResponseEntity<IngestionResponse> ingestBulkSignoffEvents(
            @Valid @RequestBody BulkSignoffEventRequest bulkRequest) throws Exception {
        log.debug("Received bulk signoff request with {} events", bulkRequest.getEvents().size());

        kafkaProducer.sendBatch(bulkRequest.getEvents());

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(IngestionResponse.builder()
                        .status("accepted")
                        .acceptedCount(bulkRequest.getEvents().size())
                        .message("Signoff events queued for processing")
                        .build());
    }
}
