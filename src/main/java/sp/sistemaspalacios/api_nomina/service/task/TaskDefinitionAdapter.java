package sp.sistemaspalacios.api_nomina.service.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_nomina.dto.task.TaskDefinition;
import sp.sistemaspalacios.api_nomina.entity.shiftSchedule.TimeSlot;
import sp.sistemaspalacios.api_nomina.entity.shiftSchedule.TimeSlotTaskTemplate;
import sp.sistemaspalacios.api_nomina.entity.task.TaskSource;
import sp.sistemaspalacios.api_nomina.entity.workObject.WorkObject;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Traduce las tareas configuradas a {@link TaskDefinition}.
 * <p>
 * Las tareas del objeto son JSON y conviven varios formatos:
 * <pre>
 *   ["Limpiar vitrina", ...]
 *   [{"text": "...", "is_mandatory": true, "deduction_amount": 100, "requires_media": false}, ...]
 *   [{"text": "...", "mandatory": false, "amount": 50}, ...]
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskDefinitionAdapter {

    private final ObjectMapper objectMapper;

    public List<TaskDefinition> fromObject(WorkObject object) {
        List<TaskDefinition> result = new ArrayList<>();
        String raw = object.getShiftTasks();
        if (raw == null || raw.isBlank()) {
            return result;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tareas del objeto " + object.getId() + " con JSON inválido", e);
        }
        if (!root.isArray()) {
            throw new IllegalArgumentException("Las tareas del objeto " + object.getId() + " deben ser una lista");
        }

        for (JsonNode node : root) {
            TaskDefinition definition = fromNode(node, object.getId());
            if (definition != null) {
                result.add(definition);
            }
        }
        return result;
    }

    public List<TaskDefinition> fromTimeSlot(TimeSlot slot) {
        List<TaskDefinition> result = new ArrayList<>();
        for (TimeSlotTaskTemplate template : slot.getTasks()) {
            if (template.getTaskText() == null || template.getTaskText().isBlank()) {
                continue;
            }
            result.add(TaskDefinition.builder()
                    .text(template.getTaskText().trim())
                    .mandatory(Boolean.TRUE.equals(template.getIsMandatory()))
                    .amount(template.getAmount())
                    .requiresMedia(Boolean.TRUE.equals(template.getRequiresMedia()))
                    .source(TaskSource.TIME_SLOT)
                    .sourceId(slot.getId())
                    .build());
        }
        return result;
    }

    private TaskDefinition fromNode(JsonNode node, Long objectId) {
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            return TaskDefinition.builder()
                    .text(text)
                    .mandatory(true)
                    .source(TaskSource.OBJECT)
                    .sourceId(objectId)
                    .build();
        }
        if (!node.isObject()) {
            log.warn("⚠️ Tarea ignorada en objeto {}: formato no soportado {}", objectId, node.getNodeType());
            return null;
        }

        String text = firstText(node, "text", "task_text");
        if (text == null || text.isBlank()) {
            return null;
        }
        return TaskDefinition.builder()
                .text(text.trim())
                .mandatory(firstBoolean(node, true, "is_mandatory", "mandatory"))
                .amount(firstDecimal(node, "amount", "deduction_amount", "bonus_amount"))
                .requiresMedia(firstBoolean(node, false, "requires_media"))
                .source(TaskSource.OBJECT)
                .sourceId(objectId)
                .build();
    }

    private static String firstText(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }

    private static boolean firstBoolean(JsonNode node, boolean fallback, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value.asBoolean(fallback);
            }
        }
        return fallback;
    }

    private static BigDecimal firstDecimal(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isNumber()) {
                return value.decimalValue();
            }
            if (value.isTextual() && !value.asText().isBlank()) {
                try {
                    return new BigDecimal(value.asText().trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Importe de tarea inválido: " + value.asText(), e);
                }
            }
        }
        return null;
    }
}
