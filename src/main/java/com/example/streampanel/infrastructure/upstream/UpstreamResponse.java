package com.example.streampanel.infrastructure.upstream;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * An open upstream response. {@link #abort()} may be called from any thread and makes a
 * blocked read on {@link #getBody()} fail promptly.
 */
public interface UpstreamResponse extends Closeable {

    int getStatus();

    /**
     * @return the first value of {@code name}, or null
     */
    String getHeader(String name);

    InputStream getBody() throws IOException;

    void abort();

    @Override
    void close();
}
