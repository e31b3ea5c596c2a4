/*
 * MIT License
 *
 * Copyright (c) 2026 Radio Recorder Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package de.corelogics.radiorec.client;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

/**
 * Runs a call up to {@code maxAttempts} times, sleeping {@code backoff} between attempts.
 * <p>
 * Only {@link IOException}s are retried. The exception of the last attempt is rethrown.
 */
@Log4j2
@Getter
public class RetryPolicy {
    @FunctionalInterface
    public interface RetryableCall<T> {
        T call() throws IOException;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration backoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration backoff) {
        this(maxAttempts, backoff, d -> Thread.sleep(d.toMillis()));
    }

    RetryPolicy(int maxAttempts, Duration backoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public static RetryPolicy once() {
        return new RetryPolicy(1, Duration.ZERO);
    }

    public <T> T execute(String description, RetryableCall<T> retryableCall) throws IOException {
        for (int attempt = 1; ; attempt++) {
            try {
                return retryableCall.call();
            } catch (IOException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("{} failed (attempt {} of {}), retrying in {}: {}",
                    description, attempt, maxAttempts, backoff, e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    var interrupted = new InterruptedIOException("Interrupted while waiting to retry " + description);
                    interrupted.addSuppressed(e);
                    throw interrupted;
                }
            }
        }
    }
}
