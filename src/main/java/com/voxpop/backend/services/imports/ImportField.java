package com.voxpop.backend.services.imports;

import java.util.Optional;

/**
 * Canonical contact fields a spreadsheet column can be mapped to. Labels are the Portuguese names
 * shown to users and used by header auto-matching.
 */
public enum ImportField {
    NAME("name", "Nome", true),
    PHONE("phone", "Telefone", true),
    EMAIL("email", "Email", false),
    CPF("cpf", "CPF", false),
    CITY("city", "Cidade", false),
    STATE("state", "Estado", false),
    NEIGHBORHOOD("neighborhood", "Bairro", false),
    ZIP_CODE("zip_code", "CEP", false),
    ELECTORAL_ZONE("electoral_zone", "Zona Eleitoral", false),
    ELECTORAL_SECTION("electoral_section", "Seção Eleitoral", false),
    BIRTH_DATE("birth_date", "Data de Nascimento", false),
    GENDER("gender", "Gênero", false);

    private final String value;
    private final String label;
    private final boolean required;

    ImportField(String value, String label, boolean required) {
        this.value = value;
        this.label = label;
        this.required = required;
    }

    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public boolean isRequired() {
        return required;
    }

    public static Optional<ImportField> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        for (ImportField field : values()) {
            if (field.value.equals(normalized)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
