package com.github.wikiexport.main;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import org.apache.commons.io.IOUtils;

import com.github.wikiexport.crawl.CrawlConfig;
import com.github.wikiexport.parsing.BasePathExtractor;
import com.github.wikiexport.parsing.DiscoveryException;
import com.github.wikiexport.parsing.NamespaceExtractor;
import com.github.wikiexport.utils.Namespace;

/**
 * Talks to a MediaWiki server through its public <code>index.php</code>
 * endpoints. One session holds a single HTTP client and cookie jar for the
 * whole crawl; all requests carry the same referrer and user agent.
 * <p>
 * When a connection limit is configured, every request holds a permit from
 * the moment it is sent until its body has been consumed.
 */
public class WikiSession implements AutoCloseable {
    public static final String USER_AGENT = "Mozilla/6.0 (Windows; U; Windows NT 6.0; en-US) Gecko/2009032609 (KHTML, like Gecko) Chrome/2.0.172.6 Safari/530.7";

    static final int CHUNK_SIZE = 0x10000;

    private static final Logger LOGGER = Logger.getLogger("wiki-export.session");

    private final URI basePath;
    private final HttpClient client;
    private final ExecutorService executor;
    private final Semaphore connections;
    private final Duration requestTimeout;

    protected WikiSession(URI basePath, CrawlConfig config) {
        this.basePath = Objects.requireNonNull(basePath);
        this.executor = Executors.newCachedThreadPool();
        this.client = newClientBuilder(config).executor(executor).build();
        this.connections = config.optLimit().isPresent() ? new Semaphore(config.optLimit().getAsInt(), true) : null;
        this.requestTimeout = config.getRequestTimeout();
    }

    public static WikiSession newSession(URI basePath, CrawlConfig config) {
        return new WikiSession(basePath, config);
    }

    private static HttpClient.Builder newClientBuilder(CrawlConfig config) {
        return HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(config.getConnectTimeout());
    }

    /**
     * Downloads the seed page and resolves the wiki's script path against it.
     */
    public static URI discoverBasePath(String seedUrl, CrawlConfig config) throws IOException, InterruptedException, DiscoveryException {
        var seed = URI.create(seedUrl);
        var client = newClientBuilder(config).build();
        var request = HttpRequest.newBuilder(seed)
            .header("User-Agent", USER_AGENT)
            .timeout(config.getRequestTimeout())
            .GET()
            .build();

        LOGGER.logp(Level.FINE, "WikiSession", "discoverBasePath", seedUrl);
        var response = client.send(request, HttpResponse.BodyHandlers.ofString());
        checkStatus(response);

        var path = BasePathExtractor.extract(response.body());

        try {
            // the seed may have been redirected
            return response.uri().resolve(path);
        } catch (IllegalArgumentException e) {
            throw new DiscoveryException("invalid base path: " + path, e);
        }
    }

    public URI getBasePath() {
        return basePath;
    }

    URI makeUri(String path, Map<String, String> params) {
        var sb = new StringBuilder(basePath.toString()).append(path);

        if (!params.isEmpty()) {
            sb.append('?').append(encodeForm(params));
        }

        return URI.create(sb.toString());
    }

    private HttpRequest.Builder newRequest(URI uri) {
        return HttpRequest.newBuilder(uri)
            .header("Referer", basePath.toString())
            .header("User-Agent", USER_AGENT)
            .timeout(requestTimeout);
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) throws IOException, InterruptedException {
        acquire();

        try {
            var response = client.send(request, handler);
            checkStatus(response);
            return response;
        } finally {
            release();
        }
    }

    private void acquire() throws InterruptedException {
        if (connections != null) {
            connections.acquire();
        }
    }

    private void release() {
        if (connections != null) {
            connections.release();
        }
    }

    private static void checkStatus(HttpResponse<?> response) throws TransportException {
        if (response.statusCode() / 100 != 2) {
            throw new TransportException(response.statusCode(), response.uri());
        }
    }

    /**
     * Performs a GET request against the base path, optionally extended by a
     * path suffix.
     */
    public byte[] get(Map<String, String> params, String path) throws IOException, InterruptedException {
        var request = newRequest(makeUri(path, params)).GET().build();
        LOGGER.logp(Level.FINER, "WikiSession", "get", request.uri().toString());
        return send(request, HttpResponse.BodyHandlers.ofByteArray()).body();
    }

    /**
     * Performs a form-encoded POST request against the base path.
     */
    public byte[] post(Map<String, String> form) throws IOException, InterruptedException {
        var request = newRequest(basePath)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
            .build();

        LOGGER.logp(Level.FINER, "WikiSession", "post", form.get("title"));
        return send(request, HttpResponse.BodyHandlers.ofByteArray()).body();
    }

    public String fetchText(Map<String, String> params) throws IOException, InterruptedException {
        var request = newRequest(makeUri("", params)).GET().build();
        LOGGER.logp(Level.FINER, "WikiSession", "fetchText", request.uri().toString());
        return send(request, HttpResponse.BodyHandlers.ofString()).body();
    }

    /**
     * Streams the media file behind a File: page into the sink in 64 KiB
     * chunks. The sink is closed in any case.
     *
     * @param name file name without the namespace prefix
     * @param sink destination stream, closed on return
     */
    public void downloadBinary(String name, OutputStream sink) throws IOException, InterruptedException {
        var request = newRequest(makeUri("", Map.of("title", "Special:Redirect/file/" + name))).GET().build();

        try (sink) {
            acquire();

            try {
                var response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());

                try (InputStream body = response.body()) {
                    checkStatus(response);
                    IOUtils.copyLarge(body, sink, new byte[CHUNK_SIZE]);
                }
            } finally {
                release();
            }
        }
    }

    public List<Namespace> fetchNamespaces() throws IOException, InterruptedException {
        var html = fetchText(Map.of("title", "Special:PrefixIndex"));
        var namespaces = NamespaceExtractor.extract(html);
        LOGGER.logp(Level.FINE, "WikiSession", "fetchNamespaces", "namespaces: " + namespaces);
        return namespaces;
    }

    /**
     * Requests the XML export of the given pages in a single POST.
     *
     * @param curonly whether to export the current revision only
     */
    public byte[] exportPages(List<String> titles, boolean curonly) throws IOException, InterruptedException {
        LOGGER.logp(Level.INFO, "WikiSession", "exportPages", String.format("export %d pages, curonly=%s", titles.size(), curonly));

        var form = new LinkedHashMap<String, String>();
        form.put("title", "Special:Export");
        form.put("action", "submit");
        form.put("pages", String.join("\n", titles));

        if (curonly) {
            form.put("curonly", "true");
        }

        return post(form);
    }

    public byte[] exportPage(String title) throws IOException, InterruptedException {
        LOGGER.logp(Level.INFO, "WikiSession", "exportPage", "export single page: " + title);
        return get(Map.of(), "/Special:Export/" + encodePathSegment(title));
    }

    static String encodeForm(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&"));
    }

    static String encodePathSegment(String segment) {
        return encode(segment).replace("+", "%20");
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
