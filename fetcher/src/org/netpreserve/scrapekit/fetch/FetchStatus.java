package org.netpreserve.scrapekit.fetch;

public enum FetchStatus {
    SUCCESS,
    CLIENT_ERROR,
    SERVER_ERROR,
    TIMEOUT,
    NETWORK_ERROR,
    CANCELLED;

    public static FetchStatus fromHttpStatus(int status) {
        if (status >= 200 && status < 300) return SUCCESS;
        if (status >= 500) return SERVER_ERROR;
        return CLIENT_ERROR;
    }
}
