package io.restfn.servlet;

import io.restfn.client.RestClient;
import io.restfn.core.ErrorResponse;
import io.restfn.core.JsonProtocol;
import io.restfn.core.ProtocolException;
import io.restfn.core.RequestContext;
import io.restfn.core.ResponseWriter;
import io.restfn.core.Router;
import io.restfn.core.ServerProtocol;
import io.restfn.core.ServerRequest;
import io.restfn.core.StatusCode;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestServletTest {

    public static class Note {
        public String text;

        public Note() {
        }

        public Note(String text) {
            this.text = text;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Note other && Objects.equals(text, other.text);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(text);
        }
    }

    interface Add {
        long add(long a, long b);
    }

    interface Append {
        Note append(Note note);
    }

    interface Deadline {
        boolean hasDeadline(RequestContext context);
    }

    interface Accept {
        StatusCode accept();
    }

    interface Fail {
        void fail();
    }

    private Server server;
    private URI base;
    private RestClient client;

    @BeforeEach
    void setUp() throws Exception {
        Router router = Router.create()
                .get("/sum/:a/:b", (Add) Long::sum)
                .post("/notes", (Append) note -> new Note(note.text + " teapot"))
                .get("/deadline", (Deadline) ctx -> ctx.deadline().isPresent())
                .put("/accept", (Accept) () -> StatusCode.of(202))
                .get("/fail", (Fail) () -> {
                    throw ErrorResponse.of(409, "conflict");
                });

        server = start(RestServlet.builder(router)
                .maxBodySize(64)
                .requestTimeout(Duration.ofSeconds(30))
                .build());
        base = apiUri(server);
        client = RestClient.builder().baseUri(base).timeout(Duration.ofSeconds(5)).build();
    }

    private static Server start(RestServlet servlet) throws Exception {
        Server jetty = new Server(0);
        ServletContextHandler context = new ServletContextHandler();
        context.setContextPath("/");
        context.addServlet(new ServletHolder(servlet), "/api/*");
        jetty.setHandler(context);
        jetty.start();
        return jetty;
    }

    private static URI apiUri(Server jetty) {
        int port = ((ServerConnector) jetty.getConnectors()[0]).getLocalPort();
        return URI.create("http://localhost:" + port + "/api");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.stop();
    }

    @Test
    void servesPathParametersBelowTheMapping() throws Exception {
        Long sum = client.get("/sum/:a/:b", Long.class, 40, 2);
        assertThat(sum).isEqualTo(42L);
    }

    @Test
    void postDecodesBodyAndAnswers201() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(base + "/notes"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{\"text\":\"hello\"}")));
        assertThat(response.statusCode()).isEqualTo(201);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                v -> assertThat(v).startsWith("application/json"));
        assertThat(response.body()).isEqualTo("{\"text\":\"hello teapot\"}");

        Note note = client.post("/notes", new Note("hi"), Note.class);
        assertThat(note).isEqualTo(new Note("hi teapot"));
    }

    @Test
    void requestTimeoutBecomesTheContextDeadline() throws Exception {
        Boolean hasDeadline = client.get("/deadline", Boolean.class);
        assertThat(hasDeadline).isTrue();
    }

    @Test
    void statusOnlyResponse() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(base + "/accept"))
                .PUT(HttpRequest.BodyPublishers.noBody()));
        assertThat(response.statusCode()).isEqualTo(202);
        assertThat(response.body()).isEmpty();
    }

    @Test
    void errorsReachTheClientAsErrorResponses() {
        assertThatThrownBy(() -> client.get("/fail", Void.class))
                .isInstanceOfSatisfying(ErrorResponse.class, e -> {
                    assertThat(e.status()).isEqualTo(409);
                    assertThat(e.getMessage()).isEqualTo("conflict");
                });
        assertThatThrownBy(() -> client.get("/sum/:a/:b", Long.class, "x", 1))
                .isInstanceOfSatisfying(ErrorResponse.class, e -> assertThat(e.status()).isEqualTo(422));
    }

    @Test
    void routingFailures() throws Exception {
        assertThat(send(HttpRequest.newBuilder(URI.create(base + "/nowhere")).GET()).statusCode())
                .isEqualTo(404);
        HttpResponse<String> wrongMethod = send(HttpRequest.newBuilder(URI.create(base + "/notes")).GET());
        assertThat(wrongMethod.statusCode()).isEqualTo(405);
        assertThat(wrongMethod.headers().firstValue("Allow")).contains("POST");
        HttpResponse<String> unknownMethod = send(HttpRequest.newBuilder(URI.create(base + "/notes"))
                .method("BREW", HttpRequest.BodyPublishers.noBody()));
        assertThat(unknownMethod.statusCode()).isEqualTo(405);
    }

    @Test
    void oversizedBodyIs413() throws Exception {
        String big = "{\"text\":\"" + "x".repeat(100) + "\"}";
        HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(base + "/notes"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(big)));
        assertThat(response.statusCode()).isEqualTo(413);
        assertThat(response.body()).contains("\"status\":413");
    }

    @Test
    void protocolFailureIs500NotBadRequest() throws Exception {
        ServerProtocol json = JsonProtocol.create();
        ServerProtocol broken = new ServerProtocol() {
            @Override
            public Object decodeRequest(ServerRequest request, Type type) throws ProtocolException {
                return json.decodeRequest(request, type);
            }

            @Override
            public void encodeResponse(ServerRequest request, ResponseWriter response, int status,
                                       Throwable error, Object body) {
                throw new IllegalArgumentException("cannot encode");
            }
        };
        Router router = Router.builder().protocol(broken).build()
                .put("/accept", (Accept) () -> StatusCode.of(202));
        Server other = start(RestServlet.create(router));
        try {
            HttpResponse<String> response = send(HttpRequest.newBuilder(URI.create(apiUri(other) + "/accept"))
                    .PUT(HttpRequest.BodyPublishers.noBody()));
            assertThat(response.statusCode()).isEqualTo(500);
        } finally {
            other.stop();
        }
    }

    private static HttpResponse<String> send(HttpRequest.Builder request) throws Exception {
        return HttpClient.newHttpClient().send(request.timeout(Duration.ofSeconds(5)).build(),
                HttpResponse.BodyHandlers.ofString());
    }
}
