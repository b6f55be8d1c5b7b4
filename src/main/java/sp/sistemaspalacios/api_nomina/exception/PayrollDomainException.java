package sp.sistemaspalacios.api_nomina.exception;

/**
 * Base de los errores de dominio de turnos y nómina.
 * Los llamadores (bot, web) traducen cada subtipo a su propio mensaje.
 */
public abstract class PayrollDomainException extends RuntimeException {

    protected PayrollDomainException(String message) {
        super(message);
    }

    protected PayrollDomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
