package com.voxpop.backend.repositories;

import com.voxpop.backend.models.Contact;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.stream.Stream;

@Repository
public interface ContactRepository extends JpaRepository<Contact, Long> {

    Optional<Contact> findByIdAndDeletedAtIsNull(Long id);

    // Row lock held by every writer so a full-row update never overwrites a concurrent transition
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Contact c WHERE c.id = :id AND c.deletedAt IS NULL")
    Optional<Contact> findByIdForUpdate(@Param("id") Long id);

    // Live phones are unique, so at most one row matches
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Contact c WHERE c.phone = :phone AND c.deletedAt IS NULL")
    Optional<Contact> findByPhoneForUpdate(@Param("phone") String phone);

    boolean existsByPhoneAndDeletedAtIsNullAndIdNot(String phone, Long id);

    boolean existsByPhoneAndDeletedAtIsNull(String phone);

    // Live contacts in id order; callers must consume inside a transaction and close the stream
    Stream<Contact> streamAllByDeletedAtIsNullOrderByIdAsc();

    @Query("SELECT COUNT(c) FROM Contact c JOIN c.tags t WHERE t.id = :tagId AND c.deletedAt IS NULL")
    long countLiveByTagId(@Param("tagId") Long tagId);

    @Modifying
    @Query(value = "DELETE FROM contact_tags WHERE tag_id = :tagId", nativeQuery = true)
    int detachTagFromAllContacts(@Param("tagId") Long tagId);
}
