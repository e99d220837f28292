package com.github.wikiexport.main;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import org.apache.commons.io.IOUtils;

import com.github.wikiexport.parsing.Utils;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * In-process MediaWiki stand-in. Requests to <code>/w/index.php</code> are
 * routed by their <code>title</code> parameter, requests to
 * <code>/w/index.php/...</code> by the decoded path suffix and anything else
 * by its path.
 */
public final class FakeWiki implements AutoCloseable {
    public static final String SCRIPT = "/w/index.php";

    public record Request(String method, String path, Map<String, String> params, Headers headers) {}

    public record Response(int status, byte[] body, Map<String, String> headers) {
        public static Response ok(String body) {
            return ok(body.getBytes(StandardCharsets.UTF_8));
        }

        public static Response ok(byte[] body) {
            return new Response(200, body, Map.of());
        }

        public static Response status(int status) {
            return new Response(status, new byte[0], Map.of());
        }

        public Response withHeader(String name, String value) {
            var copy = new LinkedHashMap<>(headers);
            copy.put(name, value);
            return new Response(status, body, copy);
        }
    }

    private final HttpServer server;
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final Map<String, Function<Request, Response>> routes = new ConcurrentHashMap<>();
    private final List<Request> requests = new CopyOnWriteArrayList<>();

    public FakeWiki() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.setExecutor(executor);
        server.start();
    }

    public FakeWiki on(String key, Function<Request, Response> route) {
        routes.put(key, route);
        return this;
    }

    public FakeWiki on(String key, String html) {
        return on(key, request -> Response.ok(html));
    }

    public URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    public URI basePath() {
        return uri(SCRIPT);
    }

    public List<Request> getRequests() {
        return requests;
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            var path = exchange.getRequestURI().getPath();
            var params = new LinkedHashMap<>(Utils.parseQuery("?" + Objects.toString(exchange.getRequestURI().getRawQuery(), "")));
            var body = new String(IOUtils.toByteArray(exchange.getRequestBody()), StandardCharsets.UTF_8);

            if (!body.isEmpty()) {
                params.putAll(Utils.parseQuery("?" + body));
            }

            var request = new Request(exchange.getRequestMethod(), path, params, exchange.getRequestHeaders());
            requests.add(request);

            final String key;

            if (path.equals(SCRIPT)) {
                key = Objects.toString(params.get("title"), "");
            } else if (path.startsWith(SCRIPT + "/")) {
                key = path.substring(SCRIPT.length() + 1);
            } else {
                key = path;
            }

            var route = routes.get(key);
            var response = route != null ? route.apply(request) : Response.status(404);

            response.headers().forEach((name, value) -> exchange.getResponseHeaders().add(name, value));
            exchange.sendResponseHeaders(response.status(), response.body().length == 0 ? -1 : response.body().length);

            if (response.body().length != 0) {
                exchange.getResponseBody().write(response.body());
            }
        } finally {
            exchange.close();
        }
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    public static String allPages(String cursor, String... titles) {
        var sb = new StringBuilder("<html><body><div id=\"mw-content-text\">");

        if (cursor != null) {
            sb.append("<div class=\"mw-allpages-nav\"><a href=\"/w/index.php?title=Special:AllPages&amp;from=")
                .append(cursor.replace(' ', '+'))
                .append("\">Next page</a></div>");
        }

        sb.append("<ul class=\"mw-allpages-chunk\">");

        for (var title : titles) {
            sb.append("<li><a href=\"/wiki/").append(title.replace(' ', '_')).append("\" title=\"").append(title).append("\">")
                .append(title).append("</a></li>");
        }

        return sb.append("</ul></div></body></html>").toString();
    }

    public static String namespaceSelect(String... options) {
        var sb = new StringBuilder("<form><select id=\"namespace\" name=\"namespace\">");

        for (int i = 0; i + 1 < options.length; i += 2) {
            sb.append("<option value=\"").append(options[i]).append("\">").append(options[i + 1]).append("</option>");
        }

        return sb.append("</select></form>").toString();
    }

    public static final String MAIN_PAGE = """
        <html><body>
        <div id="p-personal"><ul><li id="pt-login"><a href="/w/index.php?title=Special:UserLogin&amp;returnto=Main+Page">Log in</a></li></ul></div>
        <div id="p-views"><ul><li id="ca-history"><a href="/w/index.php?title=Main_Page&amp;action=history">View history</a></li></ul></div>
        </body></html>
        """;
}
