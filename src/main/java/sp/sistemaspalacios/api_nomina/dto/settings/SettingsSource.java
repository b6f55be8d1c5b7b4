package sp.sistemaspalacios.api_nomina.dto.settings;

public enum SettingsSource {
    CONTRACT,
    TIME_SLOT,
    OBJECT,
    ORG_UNIT,
    DEFAULT
}
