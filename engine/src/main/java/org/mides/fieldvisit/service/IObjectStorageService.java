package org.mides.fieldvisit.service;

public interface IObjectStorageService {
    /**
     * Stores the bytes durably and returns a URL to them.
     */
    String upload(byte[] content, String filenameHint);
}
