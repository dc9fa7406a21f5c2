package conduit.adapter.out.upstream;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import conduit.core.config.OAuthConfig;
import conduit.core.config.OAuthConfig.UpstreamConfig;
import conduit.core.model.oauth.Tokens;
import conduit.core.model.oauth.UpstreamException;
import conduit.core.model.oauth.UpstreamUser;
import conduit.core.port.out.UpstreamIdentityProvider;

/**
 * Upstream platform client over HTTP.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST {server}/oauth2/v1/token} - form-encoded code and refresh grants</li>
 *   <li>{@code GET {server}/api/{version}/sessions/current} - the signed-in user</li>
 * </ul>
 */
@ApplicationScoped
public class HttpUpstreamIdentityProvider implements UpstreamIdentityProvider {

    private static final Logger LOG = Logger.getLogger(HttpUpstreamIdentityProvider.class);

    private final WebClient webClient;
    private final UpstreamConfig config;
    private final Clock clock;

    @Inject
    public HttpUpstreamIdentityProvider(Vertx vertx, OAuthConfig config, Clock clock) {
        this(vertx, config.upstream(), clock);
    }

    public HttpUpstreamIdentityProvider(Vertx vertx, UpstreamConfig config, Clock clock) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String serverUrl() {
        return trimTrailingSlash(config.serverUrl());
    }

    @Override
    public String authorizationEndpoint() {
        return serverUrl() + config.authorizationPath();
    }

    @Override
    public Uni<Tokens> exchangeCode(String code, String codeVerifier, String redirectUri, String clientId) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "authorization_code");
        params.put("code", code);
        params.put("code_verifier", codeVerifier);
        params.put("redirect_uri", redirectUri);
        params.put("client_id", clientId);
        return requestTokens(params, "Failed to exchange authorization code");
    }

    @Override
    public Uni<Tokens> refresh(String refreshToken, String clientId) {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "refresh_token");
        params.put("refresh_token", refreshToken);
        params.put("client_id", clientId);
        return requestTokens(params, "Failed to exchange refresh token");
    }

    @Override
    public Uni<UpstreamUser> currentUser(Tokens tokens) {
        final var url = serverUrl() + "/api/" + config.apiVersion() + "/sessions/current";
        return webClient
                .getAbs(url)
                .timeout(config.timeout().toMillis())
                .putHeader("Accept", "application/json")
                .putHeader("Authorization", "Bearer " + tokens.accessToken())
                .send()
                .onFailure()
                .transform(error -> new UpstreamException(
                        "Unable to get the upstream server session: " + error.getMessage(), error))
                .map(this::parseSession);
    }

    private Uni<Tokens> requestTokens(Map<String, String> params, String failureMessage) {
        LOG.debugf("Requesting upstream tokens (%s) from %s", params.get("grant_type"), serverUrl());
        return webClient
                .postAbs(serverUrl() + config.tokenPath())
                .timeout(config.timeout().toMillis())
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json")
                .sendBuffer(Buffer.buffer(formBody(params)))
                .onFailure()
                .transform(error -> new UpstreamException(failureMessage + ": " + error.getMessage(), error))
                .map(response -> parseTokens(response, failureMessage));
    }

    private Tokens parseTokens(HttpResponse<Buffer> response, String failureMessage) {
        if (response.statusCode() != 200) {
            LOG.warnf("Upstream token endpoint returned status %d", response.statusCode());
            throw new UpstreamException(
                    failureMessage + ": " + response.statusCode() + " - " + errorSummary(response),
                    response.statusCode());
        }
        final JsonObject json = parseJson(response, "token");
        final var accessToken = json.getString("access_token");
        final var refreshToken = json.getString("refresh_token");
        final var expiresIn = json.getLong("expires_in");
        if (accessToken == null || accessToken.isBlank() || expiresIn == null || expiresIn < 0) {
            throw new UpstreamException("Upstream token response is missing required fields", 502);
        }
        return new Tokens(accessToken, refreshToken, expiresIn, clock.instant());
    }

    private UpstreamUser parseSession(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            LOG.warnf("Upstream session lookup returned status %d", response.statusCode());
            throw new UpstreamException(
                    "Unable to get the upstream server session: " + response.statusCode(), response.statusCode());
        }
        final var user = parseJson(response, "session").getJsonObject("session", new JsonObject())
                .getJsonObject("user", new JsonObject());
        final var id = user.getString("id");
        final var name = user.getString("name");
        if (id == null || id.isBlank() || name == null || name.isBlank()) {
            throw new UpstreamException("Upstream session response is missing the user", 502);
        }
        return new UpstreamUser(id, name);
    }

    private static JsonObject parseJson(HttpResponse<Buffer> response, String what) {
        try {
            final var json = response.bodyAsJsonObject();
            if (json == null) {
                throw new UpstreamException("Empty upstream " + what + " response", 502);
            }
            return json;
        } catch (RuntimeException e) {
            if (e instanceof UpstreamException upstream) {
                throw upstream;
            }
            throw new UpstreamException("Malformed upstream " + what + " response", e);
        }
    }

    /**
     * The upstream error code only; bodies may echo request parameters.
     */
    private static String errorSummary(HttpResponse<Buffer> response) {
        try {
            final var json = response.bodyAsJsonObject();
            if (json != null && json.getString("error") != null) {
                return json.getString("error");
            }
        } catch (RuntimeException e) {
            LOG.debugf("Upstream error body is not JSON: %s", e.getMessage());
        }
        return "unknown error";
    }

    private static String formBody(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
