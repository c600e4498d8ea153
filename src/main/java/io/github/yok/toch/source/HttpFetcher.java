package io.github.yok.toch.source;

import io.github.yok.toch.exception.RemoteFetchException;

/**
 * Retrieves the body of an HTTP(S) resource.
 *
 * @author Yasuharu.Okawauchi
 */
public interface HttpFetcher {

    /**
     * Fetches the full body of the given URL. No retry is attempted.
     *
     * @param url http or https URL
     * @return response body
     * @throws RemoteFetchException on transport failure or a non-2xx status
     */
    byte[] fetch(String url);
}
