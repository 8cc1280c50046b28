package com.voxpop.backend.services.audience;

import com.voxpop.backend.models.Contact;

import java.util.List;

/**
 * Point-in-time resolution of a filter: exact count, per-status breakdown and the first contacts by id.
 */
public record AudienceSnapshot(long count,
                               long leadsCount,
                               long supportersCount,
                               long blacklistCount,
                               List<Contact> sample) {
}
