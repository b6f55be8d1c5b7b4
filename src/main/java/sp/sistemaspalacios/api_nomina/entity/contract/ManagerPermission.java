package sp.sistemaspalacios.api_nomina.entity.contract;

public enum ManagerPermission {
    EDIT_SCHEDULE,
    MANAGE_TASKS,
    MANAGE_ADJUSTMENTS,
    APPROVE_PAYROLL
}
