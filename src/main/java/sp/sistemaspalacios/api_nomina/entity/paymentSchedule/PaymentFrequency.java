package sp.sistemaspalacios.api_nomina.entity.paymentSchedule;

public enum PaymentFrequency {
    WEEKLY,
    MONTHLY
}
