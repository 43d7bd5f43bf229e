package sp.sistemaspalacios.api_attendance.controller.anomaly;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_attendance.dto.PagedResponse;
import sp.sistemaspalacios.api_attendance.dto.anomaly.AnomalyEventDTO;
import sp.sistemaspalacios.api_attendance.dto.anomaly.AnomalyReviewRequest;
import sp.sistemaspalacios.api_attendance.dto.anomaly.DetectionRunSummary;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalySeverity;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyStatus;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyType;
import sp.sistemaspalacios.api_attendance.service.anomaly.AnomalyDetectionService;
import sp.sistemaspalacios.api_attendance.service.anomaly.AnomalyEventService;

import java.util.HashMap;
import java.util.Map;

import static sp.sistemaspalacios.api_attendance.controller.attendance.AttendanceController.COMPANY_HEADER;
import static sp.sistemaspalacios.api_attendance.controller.attendance.AttendanceController.USER_HEADER;

@RestController
@RequestMapping("/api/anomalies")
@RequiredArgsConstructor
public class AnomalyController {

    private final AnomalyEventService anomalyEventService;
    private final AnomalyDetectionService detectionService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> findAll(@RequestHeader(COMPANY_HEADER) Long companyId,
                                                       @RequestParam(required = false) Long userId,
                                                       @RequestParam(required = false) AnomalyStatus status,
                                                       @RequestParam(required = false) AnomalyType type,
                                                       @RequestParam(required = false) AnomalySeverity severity,
                                                       @RequestParam(required = false) Integer page,
                                                       @RequestParam(required = false) Integer limit) {
        PagedResponse<AnomalyEventDTO> result = anomalyEventService.findAll(
                companyId, userId, status, type, severity, page, limit);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", result.getData());
        response.put("meta", result.getMeta());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/summary")
    public ResponseEntity<Map<String, Object>> summary(@RequestHeader(COMPANY_HEADER) Long companyId) {
        return ResponseEntity.ok(success(null, anomalyEventService.getSummary(companyId)));
    }

    @PostMapping("/{id}/acknowledge")
    public ResponseEntity<Map<String, Object>> acknowledge(@RequestHeader(USER_HEADER) Long actorId,
                                                           @RequestHeader(COMPANY_HEADER) Long companyId,
                                                           @PathVariable Long id,
                                                           @RequestBody(required = false) AnomalyReviewRequest body) {
        String notes = body != null ? body.getNotes() : null;
        AnomalyEventDTO result = anomalyEventService.acknowledge(companyId, id, actorId.toString(), notes);
        return ResponseEntity.ok(success("Anomalía reconocida", result));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<Map<String, Object>> resolve(@RequestHeader(USER_HEADER) Long actorId,
                                                       @RequestHeader(COMPANY_HEADER) Long companyId,
                                                       @PathVariable Long id,
                                                       @RequestBody AnomalyReviewRequest body) {
        AnomalyEventDTO result = anomalyEventService.resolve(companyId, id, actorId.toString(), body.getNotes());
        return ResponseEntity.ok(success("Anomalía resuelta", result));
    }

    @PostMapping("/{id}/dismiss")
    public ResponseEntity<Map<String, Object>> dismiss(@RequestHeader(USER_HEADER) Long actorId,
                                                       @RequestHeader(COMPANY_HEADER) Long companyId,
                                                       @PathVariable Long id,
                                                       @RequestBody AnomalyReviewRequest body) {
        AnomalyEventDTO result = anomalyEventService.dismiss(companyId, id, actorId.toString(), body.getReason());
        return ResponseEntity.ok(success("Anomalía descartada", result));
    }

    /**
     * 🔹 Ejecuta el barrido diario a demanda (uso administrativo).
     */
    @PostMapping("/detection/run")
    public ResponseEntity<Map<String, Object>> runDetection() {
        DetectionRunSummary summary = detectionService.runDailyDetection();
        return ResponseEntity.ok(success("Detección ejecutada", summary));
    }

    private Map<String, Object> success(String message, Object data) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        if (message != null) {
            response.put("message", message);
        }
        response.put("data", data);
        return response;
    }
}
