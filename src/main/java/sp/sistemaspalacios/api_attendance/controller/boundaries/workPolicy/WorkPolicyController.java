package sp.sistemaspalacios.api_attendance.controller.boundaries.workPolicy;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_attendance.dto.boundaries.WorkPolicyDTO;
import sp.sistemaspalacios.api_attendance.entity.boundaries.workPolicy.WorkPolicy;
import sp.sistemaspalacios.api_attendance.service.boundaries.workPolicy.WorkPolicyService;

import java.util.HashMap;
import java.util.Map;

import static sp.sistemaspalacios.api_attendance.controller.attendance.AttendanceController.COMPANY_HEADER;

@RestController
@RequestMapping("/api/work-policy")
@RequiredArgsConstructor
public class WorkPolicyController {

    private final WorkPolicyService workPolicyService;

    /**
     * 🔹 Política vigente (la guardada o la de defecto).
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getPolicy(@RequestHeader(COMPANY_HEADER) Long companyId) {
        Map<String, Object> response = new HashMap<>();
        response.put("configured", workPolicyService.findPolicy(companyId).isPresent());
        response.put("policy", WorkPolicyDTO.from(workPolicyService.getEffectivePolicy(companyId)));
        return ResponseEntity.ok(response);
    }

    @PutMapping
    public ResponseEntity<Map<String, Object>> saveOrUpdate(@RequestHeader(COMPANY_HEADER) Long companyId,
                                                            @RequestBody WorkPolicyDTO dto) {
        WorkPolicy saved = workPolicyService.saveOrUpdate(companyId, dto);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Política laboral guardada exitosamente");
        response.put("policy", WorkPolicyDTO.from(saved));
        return ResponseEntity.ok(response);
    }
}
