package com.voxpop.backend.exceptions;

public class TagDeletionBlockedException extends RuntimeException {

    private final Long tagId;

    public TagDeletionBlockedException(Long tagId, String reason) {
        super("Tag " + tagId + " cannot be deleted: " + reason);
        this.tagId = tagId;
    }

    public Long getTagId() {
        return tagId;
    }
}
