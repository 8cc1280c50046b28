package com.voxpop.backend.services.imports;

import com.voxpop.backend.enums.Gender;

import java.time.LocalDate;

/**
 * One validated spreadsheet row in canonical form. Optional fields are null when the cell was empty.
 */
public record ImportRow(int rowNumber,
                        String name,
                        String phone,
                        String email,
                        String cpf,
                        String city,
                        String state,
                        String neighborhood,
                        String zipCode,
                        String electoralZone,
                        String electoralSection,
                        LocalDate birthDate,
                        Gender gender) {
}
