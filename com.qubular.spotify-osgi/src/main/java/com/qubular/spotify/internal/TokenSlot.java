package com.qubular.spotify.internal;

import com.qubular.spotify.AuthenticationException;
import com.qubular.spotify.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock guarded holder of a flow's token. The lock covers reads and writes of the token only; exchanges run
 * outside it, and at most one refresh is in flight at a time.
 */
public class TokenSlot {
    private static final Logger logger = LoggerFactory.getLogger(TokenSlot.class);

    @FunctionalInterface
    public interface Exchange {
        Token exchange(Token current) throws AuthenticationException, IOException;
    }

    @FunctionalInterface
    public interface UpdateListener {
        void tokenStored(Token token);
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final UpdateListener updateListener;
    private Token token;
    private CompletableFuture<Token> inFlight;

    public TokenSlot(Token initial, UpdateListener updateListener) {
        this.token = Objects.requireNonNull(initial);
        this.updateListener = updateListener;
    }

    public Token get() {
        lock.lock();
        try {
            return token;
        } finally {
            lock.unlock();
        }
    }

    public void set(Token newToken) {
        lock.lock();
        try {
            token = Objects.requireNonNull(newToken);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a token obtained outside of a refresh, such as from an authorization code, and announces it.
     */
    public void update(Token newToken) {
        set(newToken);
        announce(newToken);
    }

    /**
     * Runs <code>exchange</code> unless the slot no longer holds <code>observed</code>. If another refresh is in
     * flight, waits for it and shares its outcome.
     *
     * @return the token held after the refresh.
     */
    public Token refresh(Token observed, Exchange exchange) throws AuthenticationException, IOException {
        CompletableFuture<Token> future;
        Token base;
        lock.lock();
        try {
            if (inFlight != null) {
                logger.trace("Joining refresh in flight");
                future = inFlight;
                base = null;
            } else if (!token.equals(observed)) {
                logger.trace("Token already replaced, skipping refresh");
                return token;
            } else {
                future = new CompletableFuture<>();
                inFlight = future;
                base = token;
            }
        } finally {
            lock.unlock();
        }

        if (base == null) {
            return await(future);
        }

        Token refreshed;
        try {
            refreshed = Objects.requireNonNull(exchange.exchange(base), "Exchange returned no token");
        } catch (AuthenticationException | IOException | RuntimeException | Error e) {
            clearInFlight();
            future.completeExceptionally(e);
            throw e;
        }
        boolean stored = storeRefreshed(base, refreshed);
        Token held = stored ? refreshed : get();
        future.complete(held);
        if (stored) {
            announce(refreshed);
        }
        return held;
    }

    private void clearInFlight() {
        lock.lock();
        try {
            inFlight = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the refresh in flight, keeping the slot's token if it was replaced while the exchange ran.
     */
    private boolean storeRefreshed(Token base, Token refreshed) {
        lock.lock();
        try {
            inFlight = null;
            if (!token.equals(base)) {
                logger.debug("Token replaced during refresh, discarding refreshed token");
                return false;
            }
            token = refreshed;
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void announce(Token stored) {
        try {
            updateListener.tokenStored(stored);
        } catch (RuntimeException e) {
            logger.warn("Token update listener failed", e);
        }
    }

    private static Token await(CompletableFuture<Token> future) throws AuthenticationException, IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted waiting for token refresh", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AuthenticationException) {
                throw (AuthenticationException) cause;
            } else if (cause instanceof IOException) {
                throw (IOException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Token refresh failed", cause);
        }
    }
}
