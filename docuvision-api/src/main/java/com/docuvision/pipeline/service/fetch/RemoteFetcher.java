package com.docuvision.pipeline.service.fetch;

public interface RemoteFetcher {

    /**
     * Downloads {@code url} into a uniquely named temp file. The caller owns the returned file
     * and must close it.
     *
     * @param fallbackExtension extension (with dot) appended when neither the derived name nor
     *                          the response content type yields a known one
     * @throws FetchException with kind {@code TIMEOUT}, {@code NETWORK_ERROR} or {@code HTTP_ERROR}
     */
    FetchedFile fetch(String url, String fallbackExtension);
}
