package sp.sistemaspalacios.api_attendance.controller.boundaries.geofence;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_attendance.dto.boundaries.GeofencePolicyDTO;
import sp.sistemaspalacios.api_attendance.entity.boundaries.geofence.GeofencePolicy;
import sp.sistemaspalacios.api_attendance.service.boundaries.geofence.GeofencePolicyService;

import java.util.HashMap;
import java.util.Map;

import static sp.sistemaspalacios.api_attendance.controller.attendance.AttendanceController.COMPANY_HEADER;

@RestController
@RequestMapping("/api/geofence-policy")
@RequiredArgsConstructor
public class GeofencePolicyController {

    private final GeofencePolicyService geofencePolicyService;

    @GetMapping
    public ResponseEntity<GeofencePolicyDTO> getPolicy(@RequestHeader(COMPANY_HEADER) Long companyId) {
        GeofencePolicy policy = geofencePolicyService.getPolicy(companyId);
        return ResponseEntity.ok(new GeofencePolicyDTO(policy.getIsEnabled(), policy.getRequireGeofenceForOffice()));
    }

    @PutMapping
    public ResponseEntity<Map<String, Object>> saveOrUpdate(@RequestHeader(COMPANY_HEADER) Long companyId,
                                                            @RequestBody GeofencePolicyDTO dto) {
        GeofencePolicy saved = geofencePolicyService.saveOrUpdate(companyId, dto);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Política de geocerca guardada exitosamente");
        response.put("policy", new GeofencePolicyDTO(saved.getIsEnabled(), saved.getRequireGeofenceForOffice()));
        return ResponseEntity.ok(response);
    }
}
