package com.voxpop.backend.services;

import com.voxpop.backend.dto.ContactDto;
import com.voxpop.backend.dto.ContactRequest;
import com.voxpop.backend.enums.ContactSource;
import com.voxpop.backend.enums.Gender;
import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.exceptions.ResourceNotFoundException;
import com.voxpop.backend.exceptions.ValidationException;
import com.voxpop.backend.models.Contact;
import com.voxpop.backend.models.Tag;
import com.voxpop.backend.repositories.ContactRepository;
import com.voxpop.backend.services.audience.AudienceResolver;
import com.voxpop.backend.services.audience.ContactFilterCompiler;
import com.voxpop.backend.services.audience.FilterSpecification;
import com.voxpop.backend.services.imports.PhoneNormalizer;
import com.voxpop.backend.services.lifecycle.ContactTransitionService;
import com.voxpop.backend.util.ContactMapper;
import com.voxpop.backend.util.CpfValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Contact CRUD and user-tag assignment. Lifecycle tags are never edited here; they are set once on
 * create and afterwards only through {@link ContactTransitionService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContactService {

    static final int MAX_PAGE_SIZE = 100;

    private static final Set<ContactSource> CALLER_SOURCES = EnumSet.of(ContactSource.MANUAL, ContactSource.API, ContactSource.FORM);

    private final ContactRepository contactRepository;
    private final TagService tagService;
    private final ContactTransitionService contactTransitionService;
    private final AudienceResolver audienceResolver;
    private final ContactFilterCompiler filterCompiler;
    private final PhoneNormalizer phoneNormalizer;
    private final Clock clock;

    /**
     * Filtered listing. {@code filters} uses the segment filter keys; {@code search} is a
     * case-insensitive contains over name, phone, email and city.
     */
    @Transactional(readOnly = true)
    public Page<ContactDto> listContacts(Map<String, ?> filters, String search, int page, int size) {
        if (page < 0) {
            throw new ValidationException("page", "Page must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("size", "Page size must be between 1 and " + MAX_PAGE_SIZE);
        }

        Predicate<Contact> predicate = filterCompiler.compile(FilterSpecification.fromMap(filters));
        if (search != null && !search.isBlank()) {
            predicate = predicate.and(matchesSearch(search.trim().toLowerCase(Locale.ROOT)));
        }

        LocalDate today = LocalDate.now(clock);
        return audienceResolver.page(predicate, PageRequest.of(page, size))
                .map(contact -> ContactMapper.toDto(contact, today));
    }

    @Transactional(readOnly = true)
    public ContactDto getContact(Long id) {
        Contact contact = contactRepository.findByIdAndDeletedAtIsNull(id)
                .orElseThrow(() -> new ResourceNotFoundException("Contact", id));
        return ContactMapper.toDto(contact, LocalDate.now(clock));
    }

    @Transactional
    public ContactDto createContact(ContactRequest request) {
        Contact contact = new Contact();
        contact.setSource(parseSource(request.getSource()));
        LifecycleStatus initialStatus = parseInitialStatus(request.getInitialStatus());

        applyFields(contact, request);
        if (contactRepository.existsByPhoneAndDeletedAtIsNull(contact.getPhone())) {
            throw new ValidationException("phone", "A contact with this phone already exists");
        }

        contact.getTags().addAll(tagService.resolveUserTags(request.getTagIds(), "tagIds"));
        contactTransitionService.assignInitialStatus(contact, initialStatus);

        Contact saved = saveChecked(contact);
        log.info("Created contact {} ({}) as {}", saved.getId(), saved.getSource().getValue(), initialStatus.getValue());
        return ContactMapper.toDto(saved, LocalDate.now(clock));
    }

    @Transactional
    public ContactDto updateContact(Long id, ContactRequest request) {
        Contact contact = findContactForUpdate(id);

        applyFields(contact, request);
        if (contactRepository.existsByPhoneAndDeletedAtIsNullAndIdNot(contact.getPhone(), id)) {
            throw new ValidationException("phone", "A contact with this phone already exists");
        }

        if (request.getTagIds() != null) {
            Set<Tag> userTags = tagService.resolveUserTags(request.getTagIds(), "tagIds");
            contact.getTags().removeIf(tag -> !tag.isSystemTag());
            contact.getTags().addAll(userTags);
        }

        Contact saved = saveChecked(contact);
        log.info("Updated contact {}", id);
        return ContactMapper.toDto(saved, LocalDate.now(clock));
    }

    /**
     * Soft delete. The contact disappears from listings, audiences and phone dedup.
     */
    @Transactional
    public void deleteContact(Long id) {
        Contact contact = findContactForUpdate(id);
        contact.setDeletedAt(OffsetDateTime.now(clock));
        contactRepository.save(contact);
        log.info("Deleted contact {}", id);
    }

    @Transactional
    public ContactDto addTags(Long id, Collection<Long> tagIds) {
        Contact contact = findContactForUpdate(id);
        contact.getTags().addAll(tagService.resolveUserTags(tagIds, "tagIds"));
        Contact saved = contactRepository.save(contact);
        log.info("Added tags {} to contact {}", tagIds, id);
        return ContactMapper.toDto(saved, LocalDate.now(clock));
    }

    @Transactional
    public ContactDto removeTags(Long id, Collection<Long> tagIds) {
        if (tagIds == null || tagIds.isEmpty()) {
            throw new ValidationException("tagIds", "tagIds must not be empty");
        }
        Contact contact = findContactForUpdate(id);
        boolean touchesSystemTag = contact.getTags().stream()
                .anyMatch(tag -> tag.isSystemTag() && tagIds.contains(tag.getId()));
        if (touchesSystemTag) {
            throw new ValidationException("tagIds", "System tags change only through status transitions");
        }
        contact.getTags().removeIf(tag -> tagIds.contains(tag.getId()));
        Contact saved = contactRepository.save(contact);
        log.info("Removed tags {} from contact {}", tagIds, id);
        return ContactMapper.toDto(saved, LocalDate.now(clock));
    }

    /**
     * Loads a contact for writing. The row lock keeps a concurrent transition from being overwritten
     * by this transaction's full-row update.
     */
    private Contact findContactForUpdate(Long id) {
        return contactRepository.findByIdForUpdate(id)
                .orElseThrow(() -> new ResourceNotFoundException("Contact", id));
    }

    private void applyFields(Contact contact, ContactRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("name", "Name is required");
        }
        if (!phoneNormalizer.isValid(request.getPhone())) {
            throw new ValidationException("phone", "Invalid phone number");
        }

        contact.setName(request.getName().trim());
        contact.setPhone(phoneNormalizer.canonicalize(request.getPhone()));
        contact.setEmail(blankToNull(request.getEmail()));
        contact.setCpf(parseCpf(request.getCpf()));
        contact.setCity(blankToNull(request.getCity()));
        contact.setNeighborhood(blankToNull(request.getNeighborhood()));
        contact.setState(request.getState() == null || request.getState().isBlank()
                ? null : request.getState().trim().toUpperCase(Locale.ROOT));
        contact.setZipCode(blankToNull(request.getZipCode()));
        contact.setElectoralZone(blankToNull(request.getElectoralZone()));
        contact.setElectoralSection(blankToNull(request.getElectoralSection()));
        contact.setBirthDate(request.getBirthDate());
        contact.setGender(parseGender(request.getGender()));

        if (request.getWhatsappOptIn() != null) {
            applyOptIn(contact, request.getWhatsappOptIn());
        }
    }

    private void applyOptIn(Contact contact, boolean optIn) {
        if (optIn && !contact.isOptedIn()) {
            contact.setOptInDate(OffsetDateTime.now(clock));
        } else if (!optIn) {
            contact.setOptInDate(null);
        }
        contact.setWhatsappOptIn(optIn);
    }

    private Contact saveChecked(Contact contact) {
        try {
            return contactRepository.saveAndFlush(contact);
        } catch (DataIntegrityViolationException e) {
            log.warn("Contact save rejected by constraint: {}", e.getMostSpecificCause().getMessage());
            throw new ValidationException("phone", "A contact with this phone already exists");
        }
    }

    private Predicate<Contact> matchesSearch(String needle) {
        return contact -> contains(contact.getName(), needle)
                || contains(contact.getPhone(), needle)
                || contains(contact.getEmail(), needle)
                || contains(contact.getCity(), needle);
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private String parseCpf(String cpf) {
        if (cpf == null || cpf.isBlank()) {
            return null;
        }
        if (!CpfValidator.isValid(cpf)) {
            throw new ValidationException("cpf", "Invalid CPF");
        }
        return CpfValidator.clean(cpf);
    }

    private Gender parseGender(String gender) {
        try {
            return Gender.fromValue(gender);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("gender", e.getMessage());
        }
    }

    private LifecycleStatus parseInitialStatus(String status) {
        if (status == null || status.isBlank()) {
            return LifecycleStatus.LEAD;
        }
        LifecycleStatus parsed;
        try {
            parsed = LifecycleStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("initialStatus", e.getMessage());
        }
        if (parsed != LifecycleStatus.LEAD && parsed != LifecycleStatus.APOIADOR) {
            throw new ValidationException("initialStatus", "Initial status must be lead or apoiador");
        }
        return parsed;
    }

    private ContactSource parseSource(String source) {
        if (source == null || source.isBlank()) {
            return ContactSource.MANUAL;
        }
        ContactSource parsed;
        try {
            parsed = ContactSource.fromValue(source);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("source", e.getMessage());
        }
        if (!CALLER_SOURCES.contains(parsed)) {
            throw new ValidationException("source", "Source must be manual, api or form");
        }
        return parsed;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
