package com.flagship.media_ledger.creation;

import com.flagship.media_ledger.creation.dto.CreateCreationRequest;
import com.flagship.media_ledger.creation.dto.CreationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST endpoints for creations. The caller is identified by the
 * {@code X-User-Id} header set by the gateway in front of this service.
 */
@RestController
@RequestMapping("/api/creations")
@RequiredArgsConstructor
@Slf4j
public class CreationController {

    static final String USER_HEADER = "X-User-Id";

    private final CreationService creationService;

    /**
     * Charges the caller and starts generation.
     * 402 when the balance is too low, 503 (already refunded) when the task could not be enqueued.
     */
    @PostMapping
    public ResponseEntity<CreationResponse> submit(@RequestHeader(USER_HEADER) String userId,
                                                   @Valid @RequestBody CreateCreationRequest request) {
        log.info("Creation request from user {}: kind={}", userId, request.getKind());
        Creation creation = creationService.submit(userId, request.getKind(), request.getPrompt(),
            request.getAspectRatio());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(toResponse(creation));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CreationResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(toResponse(creationService.get(id)));
    }

    @GetMapping
    public ResponseEntity<List<CreationResponse>> listMine(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(creationService.listForOwner(userId).stream()
            .map(this::toResponse)
            .toList());
    }

    @PostMapping("/{id}/publish")
    public ResponseEntity<CreationResponse> publish(@RequestHeader(USER_HEADER) String userId,
                                                    @PathVariable("id") UUID id) {
        return ResponseEntity.ok(toResponse(creationService.publish(id, userId)));
    }

    private CreationResponse toResponse(Creation creation) {
        return CreationResponse.from(creation, creationService.outputUrl(creation).orElse(null));
    }
}
