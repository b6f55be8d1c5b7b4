package sp.sistemaspalacios.api_nomina.dto.payroll;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

@Getter
public class AdjustmentResult {

    private int processedShifts;
    private int created;
    private int updated;
    private int skippedDuplicate;
    private int removed;
    private final List<RunError> errors = new ArrayList<>();
    private final List<RunSkip> skipped = new ArrayList<>();

    public void add(ShiftAdjustmentOutcome outcome) {
        processedShifts++;
        created += outcome.getCreated();
        updated += outcome.getUpdated();
        skippedDuplicate += outcome.getUnchanged();
        removed += outcome.getRemoved();
    }

    public void addError(RunError error) {
        errors.add(error);
    }

    public void addSkip(RunSkip skip) {
        skipped.add(skip);
    }
}
