package sp.sistemaspalacios.api_attendance.controller.attendance;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_attendance.dto.PagedResponse;
import sp.sistemaspalacios.api_attendance.dto.attendance.AttendanceDayResponse;
import sp.sistemaspalacios.api_attendance.dto.attendance.AttendanceEventDTO;
import sp.sistemaspalacios.api_attendance.dto.attendance.BreakSegmentDTO;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckInRequest;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckInResponse;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckOutRequest;
import sp.sistemaspalacios.api_attendance.dto.attendance.CheckOutResponse;
import sp.sistemaspalacios.api_attendance.dto.attendance.OverrideRequest;
import sp.sistemaspalacios.api_attendance.dto.attendance.StartBreakRequest;
import sp.sistemaspalacios.api_attendance.service.attendance.AttendanceService;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Marcaciones del empleado. La identidad llega en las cabeceras X-User-Id y X-Company-Id
 * desde el gateway.
 */
@RestController
@RequestMapping("/api/attendance")
@RequiredArgsConstructor
public class AttendanceController {

    public static final String USER_HEADER = "X-User-Id";
    public static final String COMPANY_HEADER = "X-Company-Id";

    private final AttendanceService attendanceService;

    @PostMapping("/check-in")
    public ResponseEntity<Map<String, Object>> checkIn(@RequestHeader(USER_HEADER) Long userId,
                                                       @RequestHeader(COMPANY_HEADER) Long companyId,
                                                       @Valid @RequestBody CheckInRequest request) {
        CheckInResponse result = attendanceService.checkIn(userId, companyId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(success("Entrada registrada", result));
    }

    @PostMapping("/check-out")
    public ResponseEntity<Map<String, Object>> checkOut(@RequestHeader(USER_HEADER) Long userId,
                                                        @RequestHeader(COMPANY_HEADER) Long companyId,
                                                        @RequestBody(required = false) CheckOutRequest request) {
        CheckOutResponse result = attendanceService.checkOut(userId, companyId, request);
        return ResponseEntity.ok(success("Salida registrada", result));
    }

    @PostMapping("/break/start")
    public ResponseEntity<Map<String, Object>> startBreak(@RequestHeader(USER_HEADER) Long userId,
                                                          @Valid @RequestBody StartBreakRequest request) {
        BreakSegmentDTO result = attendanceService.startBreak(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(success("Descanso iniciado", result));
    }

    @PostMapping("/break/{breakId}/end")
    public ResponseEntity<Map<String, Object>> endBreak(@RequestHeader(USER_HEADER) Long userId,
                                                        @RequestHeader(COMPANY_HEADER) Long companyId,
                                                        @PathVariable Long breakId) {
        BreakSegmentDTO result = attendanceService.endBreak(userId, companyId, breakId);
        return ResponseEntity.ok(success("Descanso terminado", result));
    }

    /**
     * 🔹 Corrección de Gestión Humana. El actor es quien envía la cabecera de usuario.
     */
    @PatchMapping("/{eventId}/override")
    public ResponseEntity<Map<String, Object>> override(@RequestHeader(USER_HEADER) Long actorId,
                                                        @PathVariable Long eventId,
                                                        @RequestBody OverrideRequest request) {
        AttendanceEventDTO result = attendanceService.overrideEvent(eventId, request, actorId.toString());
        return ResponseEntity.ok(success("Marcación corregida", result));
    }

    @GetMapping("/today")
    public ResponseEntity<Map<String, Object>> today(@RequestHeader(USER_HEADER) Long userId,
                                                     @RequestHeader(COMPANY_HEADER) Long companyId) {
        AttendanceDayResponse result = attendanceService.getToday(userId, companyId);
        return ResponseEntity.ok(success(null, result));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> history(
            @RequestHeader(USER_HEADER) Long userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        PagedResponse<AttendanceDayResponse> result = attendanceService.getHistory(userId, startDate, endDate, page, limit);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", result.getData());
        response.put("meta", result.getMeta());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/summary")
    public ResponseEntity<Map<String, Object>> summary(
            @RequestHeader(USER_HEADER) Long userId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ResponseEntity.ok(success(null, attendanceService.getSummary(userId, startDate, endDate)));
    }

    @GetMapping("/locations")
    public ResponseEntity<Map<String, Object>> locations(
            @RequestHeader(COMPANY_HEADER) Long companyId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ResponseEntity.ok(success(null, attendanceService.getCheckInLocations(companyId, startDate, endDate)));
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
