package sp.sistemaspalacios.api_nomina.service.notification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private RestTemplate restTemplate;

    private NotificationService service;

    @BeforeEach
    void setUp() {
        service = new NotificationService(restTemplate);
        ReflectionTestUtils.setField(service, "enabled", true);
        ReflectionTestUtils.setField(service, "notificationServiceUrl", "http://notificaciones:3008");
        ReflectionTestUtils.setField(service, "notificationEndpoint", "/v1/events");
    }

    @Test
    @SuppressWarnings("unchecked")
    void postsStructuredEvent() {
        when(restTemplate.exchange(eq("http://notificaciones:3008/v1/events"), eq(HttpMethod.POST),
                any(HttpEntity.class), eq(Void.class))).thenReturn(new ResponseEntity<>(HttpStatus.ACCEPTED));

        boolean delivered = service.dispatch("SHIFT_CLOSED", 100L, Map.of("shiftId", 1L));

        ArgumentCaptor<HttpEntity> request = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).exchange(anyString(), eq(HttpMethod.POST), request.capture(), eq(Void.class));
        Map<String, Object> payload = (Map<String, Object>) request.getValue().getBody();
        assertThat(delivered).isTrue();
        assertThat(payload).containsEntry("event", "SHIFT_CLOSED").containsEntry("employeeId", 100L);
    }

    @Test
    void deliveryFailureIsReportedNotThrown() {
        when(restTemplate.exchange(anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(Void.class)))
                .thenThrow(new ResourceAccessException("Connection refused"));

        assertThat(service.dispatch("SHIFT_OPENED", 100L, Map.of())).isFalse();
    }

    @Test
    void disabledServiceSendsNothing() {
        ReflectionTestUtils.setField(service, "enabled", false);

        assertThat(service.dispatch("SHIFT_OPENED", 100L, Map.of())).isFalse();
        verify(restTemplate, never()).exchange(anyString(), any(HttpMethod.class), any(HttpEntity.class), eq(Void.class));
    }
}
