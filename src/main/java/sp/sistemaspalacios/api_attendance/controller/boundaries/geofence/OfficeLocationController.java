package sp.sistemaspalacios.api_attendance.controller.boundaries.geofence;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_attendance.dto.boundaries.OfficeLocationDTO;
import sp.sistemaspalacios.api_attendance.entity.boundaries.geofence.OfficeLocation;
import sp.sistemaspalacios.api_attendance.service.boundaries.geofence.OfficeLocationService;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static sp.sistemaspalacios.api_attendance.controller.attendance.AttendanceController.COMPANY_HEADER;

@RestController
@RequestMapping("/api/office-locations")
@RequiredArgsConstructor
public class OfficeLocationController {

    private final OfficeLocationService officeLocationService;

    @GetMapping
    public ResponseEntity<List<OfficeLocation>> getAll(@RequestHeader(COMPANY_HEADER) Long companyId) {
        return ResponseEntity.ok(officeLocationService.findAll(companyId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<OfficeLocation> getById(@RequestHeader(COMPANY_HEADER) Long companyId, @PathVariable Long id) {
        return ResponseEntity.ok(officeLocationService.findById(companyId, id));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestHeader(COMPANY_HEADER) Long companyId,
                                                      @RequestBody OfficeLocationDTO dto) {
        OfficeLocation saved = officeLocationService.create(companyId, dto);
        return ResponseEntity.status(HttpStatus.CREATED).body(response("Oficina creada exitosamente", saved));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Map<String, Object>> update(@RequestHeader(COMPANY_HEADER) Long companyId,
                                                      @PathVariable Long id,
                                                      @RequestBody OfficeLocationDTO dto) {
        OfficeLocation updated = officeLocationService.update(companyId, id, dto);
        return ResponseEntity.ok(response("Oficina actualizada exitosamente", updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> deactivate(@RequestHeader(COMPANY_HEADER) Long companyId,
                                                          @PathVariable Long id) {
        OfficeLocation location = officeLocationService.deactivate(companyId, id);
        return ResponseEntity.ok(response("Oficina desactivada", location));
    }

    private Map<String, Object> response(String message, OfficeLocation location) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", message);
        response.put("location", location);
        return response;
    }
}
