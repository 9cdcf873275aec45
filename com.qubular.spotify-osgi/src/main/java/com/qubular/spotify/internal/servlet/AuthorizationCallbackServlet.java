package com.qubular.spotify.internal.servlet;

import com.qubular.spotify.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.servlet.ServletException;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static javax.servlet.http.HttpServletResponse.*;
import static org.apache.commons.lang3.StringEscapeUtils.escapeHtml4;

/**
 * Receives the accounts server's redirect to the flow's redirect URI and completes the authorization.
 * Applications register it at the path of {@link OAuthConfig#getRedirectUri()} and wait on {@link #getResult()}.
 */
public class AuthorizationCallbackServlet extends HttpServlet {
    private static final Logger logger = LoggerFactory.getLogger(AuthorizationCallbackServlet.class);

    private final AuthFlow flow;
    private final CompletableFuture<Token> result = new CompletableFuture<>();

    public AuthorizationCallbackServlet(AuthFlow flow) {
        this.flow = flow;
    }

    /**
     * @return completes with the new token, or exceptionally if the user or the accounts server refused.
     */
    public CompletableFuture<Token> getResult() {
        return result;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        logger.info("Authorization callback {}", req.getRequestURI());
        Map<String, String> params = new HashMap<>();
        req.getParameterMap().forEach((name, values) -> {
            if (values.length > 0) {
                params.put(name, values[0]);
            }
        });

        if (params.get("code") == null && params.get("error") == null) {
            renderPage(resp, SC_BAD_REQUEST, "Authorization failed", "The callback carried no authorization code.");
            return;
        }

        Token token;
        try {
            token = flow.completeAuthorization(params);
        } catch (CsrfMismatchException e) {
            logger.warn("Rejecting authorization callback: {}", e.getMessage());
            renderPage(resp, SC_FORBIDDEN, "Authorization failed", "The callback state did not match.");
            return;
        } catch (AuthProviderException e) {
            logger.warn("Authorization refused: {}", e.getMessage());
            renderPage(resp, SC_BAD_GATEWAY, "Authorization failed",
                    e.getError() + ": " + (e.getErrorDescription() == null ? "" : e.getErrorDescription()));
            result.completeExceptionally(e);
            return;
        } catch (AuthenticationException e) {
            logger.warn("Unable to complete authorization: {}", e.getMessage());
            renderPage(resp, SC_BAD_REQUEST, "Authorization failed", e.getMessage());
            result.completeExceptionally(e);
            return;
        } catch (IOException e) {
            logger.warn("Unable to fetch access token", e);
            renderPage(resp, SC_BAD_GATEWAY, "Authorization failed", e.getMessage());
            result.completeExceptionally(e);
            return;
        }
        result.complete(token);
        renderPage(resp, SC_OK, "Authorized", "Authorization complete, you may close this window.");
    }

    private void renderPage(HttpServletResponse resp, int status, String title, String message) throws IOException {
        resp.setStatus(status);
        resp.setContentType("text/html");
        resp.setCharacterEncoding("UTF-8");
        try (PrintWriter writer = resp.getWriter()) {
            writer.format("<html><head><title>%s</title></head><body><h1>%s</h1><p>%s</p></body></html>",
                    escapeHtml4(title), escapeHtml4(title), escapeHtml4(message));
        }
    }
}
