package com.example.affairsdigest.service.docs;

import com.example.affairsdigest.exception.RemoteApiException;

import java.util.List;

public interface RemoteDocumentApi {
    String createDocument(String title) throws RemoteApiException;
    void batchUpdate(String documentId, List<DocumentOperation> operations) throws RemoteApiException;
}
