package com.qubular.spotify.test;

import com.qubular.spotify.*;
import com.qubular.spotify.internal.servlet.AuthorizationCallbackServlet;
import org.eclipse.jetty.client.api.ContentResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

public class AuthorizationCallbackServletTest {
    private static final Token TOKEN = new Token("BQD-access", "Bearer", Scopes.of(), "AQD-refresh",
            Instant.parse("2030-01-01T00:00:00Z"));

    @Mock
    private AuthFlow flow;

    private AutoCloseable mocks;
    private TestServer server;
    private SimpleHttpClientProvider httpClientProvider;
    private AuthorizationCallbackServlet servlet;

    @BeforeEach
    public void setUp() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);
        server = new TestServer();
        httpClientProvider = new SimpleHttpClientProvider();
        servlet = new AuthorizationCallbackServlet(flow);
        server.registerServlet("/callback", servlet);
    }

    @AfterEach
    public void tearDown() throws Exception {
        httpClientProvider.close();
        server.close();
        mocks.close();
    }

    private ContentResponse get(String pathAndQuery) throws Exception {
        return httpClientProvider.getHttpClient().GET(server.resolve(pathAndQuery));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void successfulCallbackCompletesAuthorization() throws Exception {
        when(flow.completeAuthorization(anyMap())).thenReturn(TOKEN);

        ContentResponse response = get("callback?code=AQA-code&state=abc");

        assertEquals(200, response.getStatus());
        assertTrue(response.getContentAsString().contains("Authorization complete"), response.getContentAsString());
        assertEquals(TOKEN, servlet.getResult().get(5, TimeUnit.SECONDS));
        ArgumentCaptor<Map<String, String>> params = ArgumentCaptor.forClass(Map.class);
        verify(flow).completeAuthorization(params.capture());
        assertEquals("AQA-code", params.getValue().get("code"));
        assertEquals("abc", params.getValue().get("state"));
    }

    @Test
    public void missingCodeIsBadRequest() throws Exception {
        ContentResponse response = get("callback?state=abc");
        assertEquals(400, response.getStatus());
        verify(flow, never()).completeAuthorization(anyMap());
        assertFalse(servlet.getResult().isDone());
    }

    @Test
    public void csrfMismatchIsForbiddenAndKeepsWaiting() throws Exception {
        when(flow.completeAuthorization(anyMap())).thenThrow(new CsrfMismatchException());

        ContentResponse response = get("callback?code=AQA-code&state=forged");

        assertEquals(403, response.getStatus());
        assertFalse(servlet.getResult().isDone());
    }

    @Test
    public void providerRejectionIsBadGateway() throws Exception {
        when(flow.completeAuthorization(anyMap()))
                .thenThrow(new AuthProviderException("access_denied", "<script>alert(1)</script>", 0));

        ContentResponse response = get("callback?error=access_denied&state=abc");

        assertEquals(502, response.getStatus());
        assertFalse(response.getContentAsString().contains("<script>"), response.getContentAsString());
        assertTrue(response.getContentAsString().contains("&lt;script&gt;"), response.getContentAsString());
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> servlet.getResult().get(5, TimeUnit.SECONDS));
        assertInstanceOf(AuthProviderException.class, e.getCause());
    }
}
