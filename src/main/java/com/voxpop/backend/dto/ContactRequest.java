package com.voxpop.backend.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Body for contact create and update. {@code initialStatus} and {@code source} are only read on create.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    @NotBlank(message = "Phone is required")
    private String phone;

    @Email(message = "Invalid email format")
    @Size(max = 255, message = "Email must be at most 255 characters")
    private String email;

    private String cpf;

    @Size(max = 255, message = "City must be at most 255 characters")
    private String city;

    @Size(max = 255, message = "Neighborhood must be at most 255 characters")
    private String neighborhood;

    @Pattern(regexp = "^$|^[A-Za-z]{2}$", message = "State must be a 2-letter UF code")
    private String state;

    @Size(max = 10, message = "Zip code must be at most 10 characters")
    private String zipCode;

    @Size(max = 10, message = "Electoral zone must be at most 10 characters")
    private String electoralZone;

    @Size(max = 10, message = "Electoral section must be at most 10 characters")
    private String electoralSection;

    private LocalDate birthDate;
    private String gender;
    private Boolean whatsappOptIn;

    // lead (default) or apoiador
    private String initialStatus;

    // manual (default), api or form
    private String source;

    // user tags only
    private List<Long> tagIds;
}
