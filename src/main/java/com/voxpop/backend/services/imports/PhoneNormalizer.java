package com.voxpop.backend.services.imports;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Canonical phone form shared by manual entry and import, so both dedupe on the same key.
 *
 * An 11-digit local number (area code + 9 digits) is complete and gets the 55 country prefix.
 * Numbers that already carry the prefix (12 or 13 digits starting with 55) are kept. Anything else
 * is stored as raw digits until it is completed.
 */
@Component
@Slf4j
public class PhoneNormalizer {

    private static final String COUNTRY_CODE = "55";
    private static final String DEFAULT_REGION = "BR";
    private static final int MIN_DIGITS = 10;
    private static final int MAX_DIGITS = 13;

    private final PhoneNumberUtil phoneUtil = PhoneNumberUtil.getInstance();

    /**
     * @return canonical digits, or null for blank input
     */
    public String canonicalize(String phoneNumber) {
        if (phoneNumber == null) {
            return null;
        }
        String digits = phoneNumber.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return null;
        }
        if (digits.length() == 11) {
            return COUNTRY_CODE + digits;
        }
        return digits;
    }

    /**
     * Accepts anything with 10 to 13 digits; shorter or longer input cannot become a phone number.
     */
    public boolean isValid(String phoneNumber) {
        String canonical = canonicalize(phoneNumber);
        return canonical != null && canonical.length() >= MIN_DIGITS && canonical.length() <= MAX_DIGITS;
    }

    /**
     * True once the canonical form carries the country prefix and is a possible Brazilian number.
     */
    public boolean isComplete(String canonical) {
        if (canonical == null || !canonical.startsWith(COUNTRY_CODE)
                || canonical.length() < 12 || canonical.length() > MAX_DIGITS) {
            return false;
        }
        try {
            Phonenumber.PhoneNumber parsed = phoneUtil.parse("+" + canonical, DEFAULT_REGION);
            return phoneUtil.isPossibleNumber(parsed);
        } catch (NumberParseException e) {
            log.debug("Failed to parse phone number {}: {}", canonical, e.getMessage());
            return false;
        }
    }

    /**
     * E.164 rendering for complete numbers, raw digits otherwise.
     */
    public String toE164(String canonical) {
        return isComplete(canonical) ? "+" + canonical : canonical;
    }
}
