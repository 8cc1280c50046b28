package com.voxpop.backend.services.audience;

import com.voxpop.backend.config.AudienceProperties;
import com.voxpop.backend.enums.LifecycleStatus;
import com.voxpop.backend.models.Contact;
import com.voxpop.backend.repositories.ContactRepository;
import com.voxpop.backend.services.lifecycle.LifecycleStatusDeriver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Evaluates filters against the live contact collection in a single pass over an id-ordered stream.
 * Only the sample is kept in memory; counting never collects matches.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AudienceResolver {

    private final ContactRepository contactRepository;
    private final ContactFilterCompiler filterCompiler;
    private final AudienceProperties audienceProperties;

    @Transactional(readOnly = true)
    public long count(FilterSpecification specification) {
        Predicate<Contact> predicate = filterCompiler.compile(specification);
        try (Stream<Contact> contacts = contactRepository.streamAllByDeletedAtIsNullOrderByIdAsc()) {
            return contacts.filter(predicate).count();
        }
    }

    @Transactional(readOnly = true)
    public AudienceSnapshot resolve(FilterSpecification specification) {
        return resolve(specification, audienceProperties.sampleSize());
    }

    @Transactional(readOnly = true)
    public AudienceSnapshot resolve(FilterSpecification specification, int sampleSize) {
        Predicate<Contact> predicate = filterCompiler.compile(specification);
        Map<LifecycleStatus, Long> breakdown = new EnumMap<>(LifecycleStatus.class);
        List<Contact> sample = new ArrayList<>();
        long count = 0;

        try (Stream<Contact> contacts = contactRepository.streamAllByDeletedAtIsNullOrderByIdAsc()) {
            for (Contact contact : (Iterable<Contact>) contacts::iterator) {
                if (!predicate.test(contact)) {
                    continue;
                }
                count++;
                breakdown.merge(LifecycleStatusDeriver.derive(contact), 1L, Long::sum);
                if (sample.size() < sampleSize) {
                    sample.add(contact);
                }
            }
        }

        log.debug("Resolved filter {} to {} contacts", specification.raw(), count);
        return new AudienceSnapshot(count,
                breakdown.getOrDefault(LifecycleStatus.LEAD, 0L),
                breakdown.getOrDefault(LifecycleStatus.APOIADOR, 0L),
                breakdown.getOrDefault(LifecycleStatus.BLACKLIST, 0L),
                sample);
    }

    /**
     * One page of the contacts matching {@code predicate}, in id order, with the exact total.
     */
    @Transactional(readOnly = true)
    public Page<Contact> page(Predicate<Contact> predicate, Pageable pageable) {
        List<Contact> content = new ArrayList<>();
        long offset = pageable.getOffset();
        long total = 0;

        try (Stream<Contact> contacts = contactRepository.streamAllByDeletedAtIsNullOrderByIdAsc()) {
            for (Contact contact : (Iterable<Contact>) contacts::iterator) {
                if (!predicate.test(contact)) {
                    continue;
                }
                if (total >= offset && content.size() < pageable.getPageSize()) {
                    content.add(contact);
                }
                total++;
            }
        }
        return new PageImpl<>(content, pageable, total);
    }
}
