package com.quotagate;

import com.quotagate.core.CheckResult;
import com.quotagate.core.QuotaGate;
import com.quotagate.storage.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * HTTP endpoints over the quota gate
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class QuotaController {

    private final QuotaGate quotaGate;

    public QuotaController(QuotaGate quotaGate) {
        this.quotaGate = quotaGate;
    }

    /**
     * Admit one unit of work costing the given tokens.
     * 429 with Retry-After when a ceiling is hit.
     */
    @PostMapping("/quota/check")
    public ResponseEntity<Map<String, Object>> check(
            @RequestParam(value = "tokens", defaultValue = "0") long tokens) {

        CheckResult result = quotaGate.checkAndIncrement(tokens);
        Map<String, Object> body = toBody(result);

        if (!result.isAllowed()) {
            body.put("error", "Quota exceeded");
            body.put("reason", result.getRejectionReason());
            body.put("ceiling", result.getExceededCeiling().label());

            return ResponseEntity
                    .status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(result.getRetryAfter())))
                    .body(body);
        }

        return ResponseEntity.ok(body);
    }

    @GetMapping("/quota/usage")
    public ResponseEntity<Map<String, Object>> usage() {
        return ResponseEntity.ok(toBody(quotaGate.getCurrentUsage()));
    }

    /**
     * Admin endpoint to clear the current minute and day windows
     */
    @DeleteMapping("/admin/quota")
    public ResponseEntity<Map<String, String>> reset() {
        quotaGate.reset();
        log.info("Quota windows reset via admin endpoint");

        Map<String, String> response = new HashMap<>();
        response.put("message", "Current quota windows reset");
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, String>> storeUnavailable(StoreUnavailableException e) {
        log.warn("Quota status unknown: {}", e.getMessage());
        return quotaStatusUnknown("Quota store unavailable");
    }

    @ExceptionHandler(CancellationException.class)
    public ResponseEntity<Map<String, String>> cancelled(CancellationException e) {
        log.warn("Quota check cancelled: {}", e.getMessage());
        return quotaStatusUnknown("Quota check cancelled");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", "Bad request");
        error.put("message", e.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    private ResponseEntity<Map<String, String>> quotaStatusUnknown(String reason) {
        Map<String, String> error = new HashMap<>();
        error.put("error", reason);
        error.put("message", "Quota status is unknown. Retry later.");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    private Map<String, Object> toBody(CheckResult result) {
        Map<String, Object> body = new HashMap<>();
        body.put("allowed", result.isAllowed());
        body.put("minute_requests", result.getCurrentRequests());
        body.put("minute_tokens", result.getCurrentTokens());
        body.put("day_requests", result.getCurrentDayRequests());
        body.put("reset_minute_ms", result.getResetMinute().toMillis());
        body.put("reset_day_ms", result.getResetDay().toMillis());
        return body;
    }

    private static long retryAfterSeconds(Duration retryAfter) {
        long seconds = retryAfter.getSeconds();
        return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
    }
}
