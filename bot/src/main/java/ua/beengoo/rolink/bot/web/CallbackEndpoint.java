package ua.beengoo.rolink.bot.web;

import io.javalin.Javalin;
import io.javalin.http.Context;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import ua.beengoo.rolink.bot.util.AuditLogger;
import ua.beengoo.rolink.core.service.LinkFlowException;
import ua.beengoo.rolink.core.service.LinkOutcome;
import ua.beengoo.rolink.core.service.LinkService;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/** Receives the provider redirect on {@code GET /callback} and finishes the link. */
@Slf4j
public class CallbackEndpoint {
    public static final String PATH = "/callback";

    static final String MISSING_PARAMS = "Invalid callback: missing code or state.";
    static final String SESSION_INVALID = "Verification session expired or invalid. Please run /verify again in Discord.";
    static final String AUTH_FAILED = "Failed to authenticate with Roblox";

    private final LinkService linkService;
    private final String successUrl;
    private final AuditLogger audit;
    private Javalin app;

    public CallbackEndpoint(LinkService linkService, String successUrl, AuditLogger audit) {
        this.linkService = linkService;
        this.successUrl = successUrl;
        this.audit = audit;
    }

    /** Route-configured but not started; tests drive it through JavalinTest. */
    public synchronized Javalin app() {
        if (app == null) {
            app = Javalin.create();
            app.get(PATH, this::handleCallback);
        }
        return app;
    }

    public void start(int port) {
        app().start(port);
        log.info("CallbackEndpoint started on {}", port);
    }

    public void stop() {
        if (app != null) app.stop();
    }

    void handleCallback(@NotNull Context ctx) {
        String code = ctx.queryParam("code");
        String state = ctx.queryParam("state");
        try {
            LinkOutcome out = linkService.handleCallback(code, state);
            String location = successLocation(out);
            if (audit != null) {
                audit.linked(state, out.linkage().requesterId(), out.linkage().externalId(),
                        out.linkage().externalDisplayName(), out.roles().applied(), out.roles().errors().size());
            }
            ctx.redirect(location);
        } catch (LinkFlowException ex) {
            log.warn("OAuth callback failed ({}): {}", ex.failure(), ex.getMessage());
            if (audit != null) audit.failed(state, ex.failure().name(), ex.getMessage());
            String body = switch (ex.failure()) {
                case MISSING_PARAMETERS -> MISSING_PARAMS;
                case SESSION_INVALID_OR_EXPIRED -> SESSION_INVALID;
                case TOKEN_EXCHANGE_FAILURE, PROFILE_FETCH_FAILURE -> AUTH_FAILED + ": " + ex.getMessage();
            };
            ctx.status(ex.failure().httpStatus()).result(body);
        } catch (Exception ex) {
            log.error("Unexpected error in OAuth callback", ex);
            if (audit != null) audit.failed(state, "INTERNAL", ex.getMessage());
            ctx.status(500).result("An internal error occurred: " + ex.getMessage());
        }
    }

    String successLocation(LinkOutcome out) {
        StringBuilder sb = new StringBuilder(successUrl)
                .append(successUrl.contains("?") ? '&' : '?')
                .append("success=true")
                .append("&rbx=").append(enc(out.linkage().externalDisplayName()));
        out.requesterName().ifPresent(name -> sb.append("&dc=").append(enc(name)));
        return sb.toString();
    }

    private static String enc(String v) {
        return URLEncoder.encode(v, StandardCharsets.UTF_8);
    }
}
