package sp.sistemaspalacios.api_nomina.dto.payroll;

import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Getter
public class PayrollRunResult {

    private final LocalDate targetDate;
    private int schedulesDue;
    private int entriesCreated;
    private int entriesUpdated;
    private int entriesFrozen;
    private final List<RunError> errors = new ArrayList<>();
    private final List<RunSkip> skipped = new ArrayList<>();

    public PayrollRunResult(LocalDate targetDate) {
        this.targetDate = targetDate;
    }

    public void scheduleDue() {
        schedulesDue++;
    }

    public void add(EntryOutcome outcome) {
        if (outcome == EntryOutcome.CREATED) {
            entriesCreated++;
        } else if (outcome == EntryOutcome.UPDATED) {
            entriesUpdated++;
        } else {
            entriesFrozen++;
        }
    }

    public void addError(RunError error) {
        errors.add(error);
    }

    public void addSkip(RunSkip skip) {
        skipped.add(skip);
    }
}
