package com.flightphotos.scraper.config;

import com.flightphotos.scraper.review.ReviewQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ReviewController {

    private final ReviewQueueService reviewService;

    // ── Listings ──────────────────────────────────────────────────────────────

    @GetMapping("/review/queue")
    public ResponseEntity<?> queue() {
        return handle("Review queue", reviewService::queue);
    }

    @GetMapping("/review/low-confidence")
    public ResponseEntity<?> lowConfidence() {
        return handle("Low-confidence listing", reviewService::lowConfidence);
    }

    @GetMapping("/library")
    public ResponseEntity<?> library() {
        return handle("Library listing", reviewService::library);
    }

    /**
     * Candidate with its position in the queue, for deep links.
     *
     * GET /review/42
     */
    @GetMapping("/review/{id}")
    public ResponseEntity<?> position(@PathVariable long id) {
        return handle("Review lookup " + id, () -> reviewService.position(id));
    }

    // ── Decisions ─────────────────────────────────────────────────────────────

    /**
     * POST /review/42/approve   body (optional): {"comment": "..."}
     */
    @PostMapping("/review/{id}/approve")
    public ResponseEntity<?> approve(@PathVariable long id,
                                     @RequestBody(required = false) Map<String, String> body) {
        return handle("Approve " + id, () -> reviewService.approve(id, comment(body)));
    }

    @PostMapping("/review/{id}/reject")
    public ResponseEntity<?> reject(@PathVariable long id,
                                    @RequestBody(required = false) Map<String, String> body) {
        return handle("Reject " + id, () -> reviewService.reject(id, comment(body)));
    }

    @DeleteMapping("/review/{id}")
    public ResponseEntity<?> delete(@PathVariable long id) {
        return handle("Delete " + id, () -> {
            reviewService.delete(id);
            return Map.of("status", "deleted", "id", id);
        });
    }

    private String comment(Map<String, String> body) {
        return body == null ? null : body.get("comment");
    }

    private ResponseEntity<?> handle(String action, Supplier<?> call) {
        try {
            return ResponseEntity.ok(call.get());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("{} failed: {}", action, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
