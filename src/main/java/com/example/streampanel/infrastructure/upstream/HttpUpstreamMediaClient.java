package com.example.streampanel.infrastructure.upstream;

import com.example.streampanel.common.config.AppStreamProperties;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import javax.annotation.PreDestroy;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Apache HttpClient backed upstream. Redirects are followed here rather than by the
 * client so the hop limit and the forwarded headers stay under our control.
 */
@Component
public class HttpUpstreamMediaClient implements UpstreamMediaClient {

    private static final Logger log = LoggerFactory.getLogger(HttpUpstreamMediaClient.class);
    private static final int MAX_REDIRECT_HOPS = 5;

    private final CloseableHttpClient httpClient;

    public HttpUpstreamMediaClient(AppStreamProperties properties) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(properties.getConnectTimeoutMs())
                .setConnectionRequestTimeout(properties.getConnectTimeoutMs())
                .setSocketTimeout(properties.getReadTimeoutMs())
                .build();
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(properties.getMaxUpstreamConnections());
        cm.setDefaultMaxPerRoute(properties.getMaxUpstreamConnectionsPerRoute());
        this.httpClient = HttpClients.custom()
                .setConnectionManager(cm)
                .setDefaultRequestConfig(requestConfig)
                .disableRedirectHandling()
                .build();
    }

    @Override
    public UpstreamResponse open(String url, String rangeHeader, String userAgent) throws IOException {
        String targetUrl = url;
        for (int hop = 0; hop <= MAX_REDIRECT_HOPS; hop++) {
            HttpGet httpGet = new HttpGet(toUri(targetUrl));
            if (StringUtils.hasText(userAgent)) {
                httpGet.setHeader("User-Agent", userAgent);
            }
            if (StringUtils.hasText(rangeHeader)) {
                httpGet.setHeader("Range", rangeHeader);
            }
            CloseableHttpResponse response = httpClient.execute(httpGet);
            int statusCode = response.getStatusLine().getStatusCode();
            if (!isRedirectStatus(statusCode)) {
                return new HttpUpstreamResponse(httpGet, response);
            }
            Header location = response.getFirstHeader("Location");
            EntityUtils.consumeQuietly(response.getEntity());
            response.close();
            if (location == null || !StringUtils.hasText(location.getValue())) {
                throw new IOException("Upstream redirect without Location, status=" + statusCode);
            }
            String redirectedUrl = resolveRedirectUrl(targetUrl, location.getValue());
            log.info("UPSTREAM_REDIRECT hop={} status={} to={}", hop + 1, statusCode, redirectedUrl);
            targetUrl = redirectedUrl;
        }
        throw new IOException("Upstream redirected more than " + MAX_REDIRECT_HOPS + " times");
    }

    @PreDestroy
    public void shutdown() throws IOException {
        httpClient.close();
    }

    private boolean isRedirectStatus(int statusCode) {
        return statusCode == 301 || statusCode == 302 || statusCode == 303
                || statusCode == 307 || statusCode == 308;
    }

    private URI toUri(String url) throws IOException {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            throw new IOException("Invalid upstream URL", e);
        }
    }

    private String resolveRedirectUrl(String baseUrl, String location) throws IOException {
        return toUri(baseUrl).resolve(location.trim()).toString();
    }

    private static final class HttpUpstreamResponse implements UpstreamResponse {

        private final HttpGet request;
        private final CloseableHttpResponse response;

        private HttpUpstreamResponse(HttpGet request, CloseableHttpResponse response) {
            this.request = request;
            this.response = response;
        }

        @Override
        public int getStatus() {
            return response.getStatusLine().getStatusCode();
        }

        @Override
        public String getHeader(String name) {
            Header header = response.getFirstHeader(name);
            return header == null ? null : header.getValue();
        }

        @Override
        public InputStream getBody() throws IOException {
            HttpEntity entity = response.getEntity();
            if (entity == null) {
                return InputStream.nullInputStream();
            }
            return entity.getContent();
        }

        @Override
        public void abort() {
            request.abort();
        }

        @Override
        public void close() {
            try {
                response.close();
            } catch (IOException e) {
                log.debug("Upstream response close failed", e);
            }
        }
    }
}
