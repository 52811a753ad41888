package com.company.searchindexer.exception;

import lombok.Getter;

@Getter
public class PublicationNotFoundException extends RuntimeException {

    private final long publicationId;

    public PublicationNotFoundException(long publicationId) {
        super("Publication " + publicationId + " not found");
        this.publicationId = publicationId;
    }
}
