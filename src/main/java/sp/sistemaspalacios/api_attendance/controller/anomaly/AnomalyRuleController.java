package sp.sistemaspalacios.api_attendance.controller.anomaly;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_attendance.entity.anomaly.AnomalyRule;
import sp.sistemaspalacios.api_attendance.service.anomaly.AnomalyRuleService;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static sp.sistemaspalacios.api_attendance.controller.attendance.AttendanceController.COMPANY_HEADER;

@RestController
@RequestMapping("/api/anomaly-rules")
@RequiredArgsConstructor
public class AnomalyRuleController {

    private final AnomalyRuleService ruleService;

    @GetMapping
    public ResponseEntity<List<AnomalyRule>> getAll(@RequestHeader(COMPANY_HEADER) Long companyId) {
        return ResponseEntity.ok(ruleService.findAll(companyId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AnomalyRule> getById(@RequestHeader(COMPANY_HEADER) Long companyId, @PathVariable Long id) {
        return ResponseEntity.ok(ruleService.findById(companyId, id));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestHeader(COMPANY_HEADER) Long companyId,
                                                      @RequestBody AnomalyRule rule) {
        AnomalyRule saved = ruleService.create(companyId, rule);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Regla guardada exitosamente");
        response.put("rule", saved);
        return ResponseEntity.ok(response);
    }

    @PutMapping("/{id}")
    public ResponseEntity<Map<String, Object>> update(@RequestHeader(COMPANY_HEADER) Long companyId,
                                                      @PathVariable Long id,
                                                      @RequestBody AnomalyRule changes) {
        AnomalyRule updated = ruleService.update(companyId, id, changes);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Regla actualizada exitosamente");
        response.put("rule", updated);
        return ResponseEntity.ok(response);
    }

    @PatchMapping("/{id}/toggle")
    public ResponseEntity<Map<String, Object>> toggle(@RequestHeader(COMPANY_HEADER) Long companyId,
                                                      @PathVariable Long id,
                                                      @RequestBody Map<String, Boolean> body) {
        Boolean isEnabled = body.get("isEnabled");
        AnomalyRule updated = ruleService.toggleEnabled(companyId, id, isEnabled);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", updated.getIsEnabled() ? "Regla activada" : "Regla desactivada");
        response.put("rule", updated);
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@RequestHeader(COMPANY_HEADER) Long companyId,
                                                      @PathVariable Long id) {
        ruleService.delete(companyId, id);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Regla eliminada");
        return ResponseEntity.ok(response);
    }

    @PostMapping("/initialize")
    public ResponseEntity<Map<String, Object>> initializeDefaults(@RequestHeader(COMPANY_HEADER) Long companyId) {
        List<AnomalyRule> rules = ruleService.initializeDefaultRules(companyId);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Reglas por defecto inicializadas");
        response.put("rules", rules);
        return ResponseEntity.ok(response);
    }
}
