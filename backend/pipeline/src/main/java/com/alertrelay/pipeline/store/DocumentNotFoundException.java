package com.alertrelay.pipeline.store;

public class DocumentNotFoundException extends PersistenceException {
    private final String collection;
    private final String documentId;

    public DocumentNotFoundException(String collection, String documentId) {
        super("Document not found: " + collection + "/" + documentId);
        this.collection = collection;
        this.documentId = documentId;
    }

    public String collection() {
        return collection;
    }

    public String documentId() {
        return documentId;
    }
}
