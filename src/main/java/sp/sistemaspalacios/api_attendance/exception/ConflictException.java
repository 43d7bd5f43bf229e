package sp.sistemaspalacios.api_attendance.exception;

/**
 * La transición no es válida para el estado actual de la jornada
 * (sesión abierta, descanso en curso, marcación concurrente perdida, etc.).
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
