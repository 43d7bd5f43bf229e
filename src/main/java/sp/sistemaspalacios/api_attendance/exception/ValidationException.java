package sp.sistemaspalacios.api_attendance.exception;

/**
 * Entrada mal formada o fuera de rango. No se reintenta.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
