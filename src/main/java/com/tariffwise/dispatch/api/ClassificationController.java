package com.tariffwise.dispatch.api;

import com.tariffwise.core.model.ClassificationRequest;
import com.tariffwise.core.model.FinalPayload;
import com.tariffwise.core.service.ClassificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * REST controller for classification requests. Runs synchronously; every accepted request
 * returns a {@link FinalPayload}, including degraded and escalated ones.
 */
@RestController
@RequestMapping("/api/v1/classifications")
public class ClassificationController {

    private static final Logger log = LoggerFactory.getLogger(ClassificationController.class);

    private final ClassificationService classificationService;

    public ClassificationController(ClassificationService classificationService) {
        this.classificationService = classificationService;
    }

    /**
     * POST /api/v1/classifications: classify one or more product lines.
     */
    @PostMapping
    public ResponseEntity<?> classify(@RequestBody ClassificationRequestBody body) {
        ClassificationRequest request;
        try {
            request = body.toRequest();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        Instant deadline = body.timeoutSeconds() != null && body.timeoutSeconds() > 0
                ? Instant.now().plusSeconds(body.timeoutSeconds())
                : null;
        log.info("Accepted classification {} ({} line(s))", request.requestId(), request.lines().size());
        return ResponseEntity.ok(classificationService.classify(request, deadline));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        Throwable root = e.getMostSpecificCause();
        log.debug("Rejected classification body: {}", root.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", "Invalid request body: " + root.getMessage()));
    }
}
