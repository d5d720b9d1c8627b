package com.example.streampanel.infrastructure.upstream;

import java.io.IOException;

/**
 * Opens the upstream media resource behind a channel.
 */
public interface UpstreamMediaClient {

    /**
     * Issues a GET for {@code url}, following redirects up to a fixed hop limit.
     *
     * @param rangeHeader client Range header to forward, may be null
     * @param userAgent   User-Agent to send upstream
     * @return the final non-redirect response; the caller must close it
     * @throws IOException when the upstream cannot be reached or redirects do not converge
     */
    UpstreamResponse open(String url, String rangeHeader, String userAgent) throws IOException;
}
