package com.voxpop.backend.services.audience;

import com.voxpop.backend.enums.ContactSource;
import com.voxpop.backend.enums.Gender;
import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.models.Contact;
import com.voxpop.backend.services.lifecycle.LifecycleStatusDeriver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Turns a {@link FilterSpecification} into a predicate over contacts: one clause per active key,
 * all ANDed. Text fields match case-insensitively on the whole trimmed value. Ages are computed
 * against today's date from the injected clock, so two compilations on the same day agree.
 */
@Component
@RequiredArgsConstructor
public class ContactFilterCompiler {

    private final Clock clock;

    public Predicate<Contact> compile(FilterSpecification specification) {
        LocalDate today = LocalDate.now(clock);
        Predicate<Contact> predicate = contact -> true;

        for (Map.Entry<FilterKey, FilterValue> clause : specification.activeClauses().entrySet()) {
            predicate = predicate.and(compileClause(clause.getKey(), clause.getValue(), today));
        }
        return predicate;
    }

    Predicate<Contact> compileClause(FilterKey key, FilterValue value, LocalDate today) {
        switch (key) {
            case CONTACT_STATUS: {
                LifecycleStatus status = LifecycleStatus.fromValue(text(value));
                return contact -> LifecycleStatusDeriver.derive(contact) == status;
            }
            case CITY:
                return textEquals(Contact::getCity, text(value));
            case STATE:
                return textEquals(Contact::getState, text(value));
            case NEIGHBORHOOD:
                return textEquals(Contact::getNeighborhood, text(value));
            case ELECTORAL_ZONE:
                return textEquals(Contact::getElectoralZone, text(value));
            case ELECTORAL_SECTION:
                return textEquals(Contact::getElectoralSection, text(value));
            case GENDER: {
                Gender gender = Gender.fromValue(text(value));
                return contact -> contact.getGender() == gender;
            }
            case SOURCE: {
                ContactSource source = ContactSource.fromValue(text(value));
                return contact -> contact.getSource() == source;
            }
            case TAGS_ANY: {
                Set<Long> wanted = Set.copyOf(((FilterValue.IdList) value).ids());
                return contact -> contact.getTagIds().stream().anyMatch(wanted::contains);
            }
            case TAGS_ALL: {
                Set<Long> wanted = Set.copyOf(((FilterValue.IdList) value).ids());
                return contact -> contact.getTagIds().containsAll(wanted);
            }
            case AGE_MIN: {
                int min = ((FilterValue.Numeric) value).value();
                return contact -> contact.getBirthDate() != null && age(contact.getBirthDate(), today) >= min;
            }
            case AGE_MAX: {
                int max = ((FilterValue.Numeric) value).value();
                return contact -> contact.getBirthDate() != null && age(contact.getBirthDate(), today) <= max;
            }
            case WHATSAPP_OPT_IN: {
                boolean optIn = ((FilterValue.Flag) value).value();
                return contact -> contact.isOptedIn() == optIn;
            }
            default:
                throw new IllegalStateException("No clause for filter key " + key);
        }
    }

    public int ageOf(LocalDate birthDate) {
        return age(birthDate, LocalDate.now(clock));
    }

    private static int age(LocalDate birthDate, LocalDate today) {
        return Period.between(birthDate, today).getYears();
    }

    private static String text(FilterValue value) {
        return ((FilterValue.Text) value).value().trim();
    }

    private static Predicate<Contact> textEquals(Function<Contact, String> field, String expected) {
        return contact -> {
            String actual = field.apply(contact);
            return actual != null && actual.trim().equalsIgnoreCase(expected);
        };
    }
}
