package sp.sistemaspalacios.api_nomina.service.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reenvía eventos de dominio al servicio de notificaciones externo.
 * El servicio externo decide el canal y el texto; aquí solo viaja el evento estructurado.
 * Un fallo de entrega se registra y no afecta a la operación que originó el evento.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final RestTemplate restTemplate;

    @Value("${notification.service.enabled:true}")
    private boolean enabled;

    @Value("${notification.service.url:http://localhost:3008}")
    private String notificationServiceUrl;

    @Value("${notification.service.endpoint:/v1/events}")
    private String notificationEndpoint;

    public boolean dispatch(String eventType, Long employeeId, Map<String, Object> data) {
        if (!enabled) {
            log.debug("Notificaciones desactivadas; evento {} descartado", eventType);
            return false;
        }

        String url = notificationServiceUrl + notificationEndpoint;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", eventType);
        payload.put("employeeId", employeeId);
        payload.put("data", data);

        log.info("📤 Enviando evento {} del empleado {} - URL: {}", eventType, employeeId, url);
        log.debug("📦 Payload: {}", payload);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(payload, headers);

        try {
            ResponseEntity<Void> response = restTemplate.exchange(url, HttpMethod.POST, request, Void.class);
            if (response.getStatusCode().is2xxSuccessful()) {
                log.info("✅ Evento {} entregado", eventType);
                return true;
            }
            log.warn("⚠️ Respuesta no exitosa para evento {}: {}", eventType, response.getStatusCode());
            return false;
        } catch (RestClientException e) {
            log.error("❌ Error enviando evento {}: {}", eventType, e.getMessage(), e);
            return false;
        }
    }
}
