package sp.sistemaspalacios.api_nomina.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * "Hoy" según la zona horaria de negocio; los jobs y la API lo usan como fecha objetivo por defecto.
 */
@Component
public class BusinessClock {

    private final Clock clock;
    private final ZoneId zone;

    public BusinessClock(Clock clock, @Value("${payroll.default-timezone:Europe/Moscow}") String timezone) {
        this.clock = clock;
        this.zone = ZoneId.of(timezone);
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }
}
