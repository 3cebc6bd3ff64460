package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.FetchedPage;
import io.newsharvest.ingestion.api.exception.ErrorCategory;
import io.newsharvest.ingestion.api.exception.PageFetchException;
import io.newsharvest.ingestion.config.NewsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * Single-attempt HTTP GET shared by the feed fetcher and the content extractor.
 * Callers wrap it in the retry template for their boundary.
 */
@Service
public class PageFetcher {

    private static final Logger logger = LoggerFactory.getLogger(PageFetcher.class);

    public static final String FEED_ACCEPT = "application/rss+xml, application/atom+xml, application/xml, text/xml, */*";
    public static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private static final List<String> DEFAULT_USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36"
    );

    private final AtomicInteger userAgentIndex = new AtomicInteger();
    private final NewsConfig newsConfig;

    public PageFetcher(NewsConfig newsConfig) {
        this.newsConfig = newsConfig;
    }

    /**
     * Fetch a URL once with browser-like headers and bounded timeouts.
     *
     * @param url    absolute http(s) URL
     * @param accept value for the Accept header
     * @return the response body, capped at the configured byte limit
     */
    public FetchedPage fetch(String url, String accept) throws PageFetchException {
        HttpURLConnection connection = null;

        try {
            if (url == null || url.isBlank()) {
                throw new PageFetchException(url, "URL is null or empty", ErrorCategory.INVALID_URL);
            }

            URI uri = new URI(url.trim());
            if (uri.getScheme() == null || !uri.getScheme().toLowerCase(Locale.ROOT).startsWith("http")) {
                throw new PageFetchException(url, "Unsupported URL scheme: " + url, ErrorCategory.INVALID_URL);
            }

            connection = (HttpURLConnection) uri.toURL().openConnection();
            configureConnection(connection, accept);
            connection.connect();

            int status = connection.getResponseCode();
            logger.debug("GET {} -> {} ({})", url, status, connection.getContentType());

            validateHttpResponse(connection, url);

            return readResponse(connection, url);

        } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
            throw new PageFetchException(url, "Invalid URL format: " + url, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw new PageFetchException(url, "Connection timeout for: " + url, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw new PageFetchException(url, "Connection refused: " + url, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw new PageFetchException(url, "Unknown host: " + url, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw new PageFetchException(url, "Network error: " + url, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw new PageFetchException(url, "I/O error reading: " + url, e, ErrorCategory.IO_ERROR);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void configureConnection(HttpURLConnection connection, String accept) {
        connection.setConnectTimeout(newsConfig.http().connectTimeout());
        connection.setReadTimeout(newsConfig.http().readTimeout());

        connection.setRequestProperty("User-Agent", getNextUserAgent());
        connection.setRequestProperty("Accept", accept);
        connection.setRequestProperty("Accept-Language", "en-US,en;q=0.9");
        connection.setRequestProperty("Accept-Encoding", "gzip, deflate");
        connection.setRequestProperty("Cache-Control", "no-cache");
        connection.setRequestProperty("Connection", "close");

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(false);
    }

    private void validateHttpResponse(HttpURLConnection connection, String url) throws IOException, PageFetchException {
        int responseCode = connection.getResponseCode();
        String responseMessage = connection.getResponseMessage();

        switch (responseCode) {
            case HttpURLConnection.HTTP_NOT_FOUND:
            case HttpURLConnection.HTTP_GONE:
                throw new PageFetchException(url, "Not found (" + responseCode + "): " + url, ErrorCategory.NOT_FOUND);

            case HttpURLConnection.HTTP_FORBIDDEN:
                throw new PageFetchException(url, "Access forbidden (403): " + url, ErrorCategory.ACCESS_FORBIDDEN);

            case HttpURLConnection.HTTP_UNAUTHORIZED:
                throw new PageFetchException(url, "Authentication required (401): " + url, ErrorCategory.AUTH_REQUIRED);

            case 429:
                throw new PageFetchException(url, "Rate limited (429): " + url, ErrorCategory.RATE_LIMITED);

            case HttpURLConnection.HTTP_INTERNAL_ERROR:
                throw new PageFetchException(url, "Server error (500): " + url, ErrorCategory.SERVER_ERROR);

            case HttpURLConnection.HTTP_BAD_GATEWAY:
            case HttpURLConnection.HTTP_UNAVAILABLE:
            case HttpURLConnection.HTTP_GATEWAY_TIMEOUT:
                throw new PageFetchException(url, "Server temporarily unavailable (" + responseCode + "): " + url,
                        ErrorCategory.SERVER_UNAVAILABLE);

            default:
                if (responseCode >= 500) {
                    throw new PageFetchException(url,
                            String.format("Server error %d (%s): %s", responseCode, responseMessage, url),
                            ErrorCategory.SERVER_ERROR);
                }
                if (responseCode >= 300) {
                    throw new PageFetchException(url,
                            String.format("HTTP error %d (%s): %s", responseCode, responseMessage, url),
                            ErrorCategory.HTTP_ERROR);
                }
        }
    }

    private FetchedPage readResponse(HttpURLConnection connection, String url) throws IOException, PageFetchException {
        int maxBytes = newsConfig.http().maxBodyBytes() > 0 ? newsConfig.http().maxBodyBytes() : Integer.MAX_VALUE;
        String contentType = connection.getContentType();

        try (InputStream raw = connection.getInputStream();
             InputStream in = decode(raw, connection.getContentEncoding())) {

            byte[] body = in.readNBytes(maxBytes);
            if (body.length == maxBytes && in.read() != -1) {
                logger.warn("Response body for {} truncated at {} bytes", url, maxBytes);
            }

            return new FetchedPage(
                    url,
                    connection.getURL().toString(),
                    connection.getResponseCode(),
                    contentType,
                    body,
                    parseCharset(contentType).orElse(StandardCharsets.UTF_8)
            );
        }
    }

    private InputStream decode(InputStream in, String encoding) throws IOException {
        if (encoding == null) return in;

        String lower = encoding.toLowerCase(Locale.ROOT);
        if (lower.contains("gzip")) return new GZIPInputStream(in);
        if (lower.contains("deflate")) return new InflaterInputStream(in);
        return in;
    }

    static Optional<Charset> parseCharset(String contentType) {
        if (contentType == null) return Optional.empty();

        String lower = contentType.toLowerCase(Locale.ROOT);
        int index = lower.indexOf("charset=");
        if (index < 0) return Optional.empty();

        String name = lower.substring(index + "charset=".length()).trim();
        int semi = name.indexOf(';');
        if (semi >= 0) name = name.substring(0, semi).trim();
        name = name.replace("\"", "").trim();

        try {
            return Optional.of(Charset.forName(name));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            logger.debug("Ignoring unknown charset '{}'", name);
            return Optional.empty();
        }
    }

    private String getNextUserAgent() {
        List<String> userAgents = newsConfig.http().userAgents();
        if (userAgents == null || userAgents.isEmpty()) {
            userAgents = DEFAULT_USER_AGENTS;
        }
        int index = Math.floorMod(userAgentIndex.getAndIncrement(), userAgents.size());
        return userAgents.get(index);
    }
}
