package org.bucketindex.indexing.service;

/**
 * Thrown when a build is requested while another one is still running.
 */
public class BuildInProgressException extends IllegalStateException {
    public BuildInProgressException(String message) {
        super(message);
    }
}
