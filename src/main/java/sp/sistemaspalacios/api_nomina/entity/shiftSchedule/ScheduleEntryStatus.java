package sp.sistemaspalacios.api_nomina.entity.shiftSchedule;

public enum ScheduleEntryStatus {
    PLANNED,
    /** Alias heredado de PLANNED. */
    CONFIRMED,
    COMPLETED,
    CANCELLED;

    public boolean isOpen() {
        return this == PLANNED || this == CONFIRMED;
    }
}
