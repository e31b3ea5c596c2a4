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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class RetryPolicyTest {
    private final List<Duration> sleeps = new ArrayList<>();

    private RetryPolicy policy(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(250), sleeps::add);
    }

    @Test
    void givenSuccessOnFirstAttempt_thenDoNotSleep() throws IOException {
        assertThat(policy(3).execute("test", () -> "done")).isEqualTo("done");
        assertThat(sleeps).isEmpty();
    }

    @Test
    void givenTransientFailures_thenRetryUntilSuccess() throws IOException {
        var calls = new AtomicInteger();

        var result = policy(3).execute("test", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("boom " + calls.get());
            }
            return calls.get();
        });

        assertThat(result).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(250), Duration.ofMillis(250));
    }

    @Test
    void givenPermanentFailure_thenRethrowLastException() {
        var calls = new AtomicInteger();

        assertThatExceptionOfType(IOException.class)
            .isThrownBy(() -> policy(2).execute("test", () -> {
                throw new IOException("boom " + calls.incrementAndGet());
            }))
            .withMessage("boom 2");
        assertThat(sleeps).hasSize(1);
    }

    @Test
    void givenSingleAttempt_thenNeverRetry() {
        var calls = new AtomicInteger();

        assertThatExceptionOfType(IOException.class)
            .isThrownBy(() -> RetryPolicy.once().execute("test", () -> {
                calls.incrementAndGet();
                throw new IOException("boom");
            }));
        assertThat(calls).hasValue(1);
    }

    @Test
    void givenInterruptWhileSleeping_thenThrowInterruptedIoException() {
        var sut = new RetryPolicy(3, Duration.ofSeconds(1), d -> {
            throw new InterruptedException("stop");
        });
        try {
            assertThatExceptionOfType(InterruptedIOException.class)
                .isThrownBy(() -> sut.execute("test", () -> {
                    throw new IOException("boom");
                }))
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void givenNoAttempts_thenReject() {
        assertThatIllegalArgumentException().isThrownBy(() -> new RetryPolicy(0, Duration.ZERO));
    }
}
