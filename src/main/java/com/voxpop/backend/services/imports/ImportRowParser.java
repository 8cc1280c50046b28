package com.voxpop.backend.services.imports;

import com.voxpop.backend.enums.Gender;
import com.voxpop.backend.exceptions.ValidationException;
import com.voxpop.backend.util.CpfValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Applies a column mapping to a raw row and validates the result. The first failing field is reported
 * through {@link ValidationException}; the row then produces no contact.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImportRowParser {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern UF = Pattern.compile("^[A-Z]{2}$");

    // Day-first formats are tried before ISO and month-first
    private static final List<DateTimeFormatter> DATE_FORMATTERS = List.of(
            DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd-MM-uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("dd.MM.uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu/MM/dd").withResolverStyle(ResolverStyle.STRICT)
    );

    // Column widths of the contacts table; fields validated by format (phone, cpf, state) are not listed
    private static final Map<ImportField, Integer> MAX_LENGTHS = new EnumMap<>(Map.of(
            ImportField.NAME, 255,
            ImportField.EMAIL, 255,
            ImportField.CITY, 255,
            ImportField.NEIGHBORHOOD, 255,
            ImportField.ZIP_CODE, 10,
            ImportField.ELECTORAL_ZONE, 10,
            ImportField.ELECTORAL_SECTION, 10));

    private final PhoneNormalizer phoneNormalizer;

    /**
     * @param mapping header -> field, as confirmed at submission
     */
    public ImportRow parse(int rowNumber, Map<String, String> raw, Map<String, ImportField> mapping) {
        Map<ImportField, String> values = new EnumMap<>(ImportField.class);
        for (Map.Entry<String, ImportField> column : mapping.entrySet()) {
            String cell = raw.get(column.getKey());
            if (cell != null && !cell.isBlank()) {
                values.put(column.getValue(), cell.trim());
            }
        }

        String name = values.get(ImportField.NAME);
        if (name == null) {
            throw new ValidationException(ImportField.NAME.getValue(), "Name is required");
        }
        checkLengths(values);

        String phone = values.get(ImportField.PHONE);
        if (phone == null) {
            throw new ValidationException(ImportField.PHONE.getValue(), "Phone is required");
        }
        if (!phoneNormalizer.isValid(phone)) {
            throw new ValidationException(ImportField.PHONE.getValue(), "Invalid phone number: " + phone);
        }

        return new ImportRow(
                rowNumber,
                name,
                phoneNormalizer.canonicalize(phone),
                parseEmail(values.get(ImportField.EMAIL)),
                parseCpf(values.get(ImportField.CPF)),
                values.get(ImportField.CITY),
                parseState(values.get(ImportField.STATE)),
                values.get(ImportField.NEIGHBORHOOD),
                values.get(ImportField.ZIP_CODE),
                values.get(ImportField.ELECTORAL_ZONE),
                values.get(ImportField.ELECTORAL_SECTION),
                parseBirthDate(values.get(ImportField.BIRTH_DATE)),
                parseGender(values.get(ImportField.GENDER)));
    }

    private static void checkLengths(Map<ImportField, String> values) {
        MAX_LENGTHS.forEach((field, max) -> {
            String value = values.get(field);
            if (value != null && value.length() > max) {
                throw new ValidationException(field.getValue(),
                        field.getValue() + " must be at most " + max + " characters (got " + value.length() + ")");
            }
        });
    }

    private String parseEmail(String email) {
        if (email == null) {
            return null;
        }
        String normalized = email.toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(normalized).matches()) {
            throw new ValidationException(ImportField.EMAIL.getValue(), "Invalid email: " + email);
        }
        return normalized;
    }

    private String parseCpf(String cpf) {
        if (cpf == null) {
            return null;
        }
        if (!CpfValidator.isValid(cpf)) {
            throw new ValidationException(ImportField.CPF.getValue(), "Invalid CPF: " + cpf);
        }
        return CpfValidator.clean(cpf);
    }

    private String parseState(String state) {
        if (state == null) {
            return null;
        }
        String uf = state.toUpperCase(Locale.ROOT);
        if (!UF.matcher(uf).matches()) {
            throw new ValidationException(ImportField.STATE.getValue(), "State must be a 2-letter UF code: " + state);
        }
        return uf;
    }

    LocalDate parseBirthDate(String date) {
        if (date == null) {
            return null;
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(date, formatter);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        log.debug("Unparseable birth date: {}", date);
        throw new ValidationException(ImportField.BIRTH_DATE.getValue(), "Unrecognized date: " + date);
    }

    private Gender parseGender(String gender) {
        try {
            return Gender.fromValue(gender);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ImportField.GENDER.getValue(), "Unknown gender: " + gender);
        }
    }
}
