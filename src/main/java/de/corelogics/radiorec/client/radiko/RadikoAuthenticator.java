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

package de.corelogics.radiorec.client.radiko;

import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.model.AuthSession;
import de.corelogics.radiorec.util.HttpUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import lombok.val;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Two-phase radiko handshake.
 * <p>
 * Phase 1 hands out a token plus an offset and a length into a well known key. Phase 2 proves
 * knowledge of the key by sending the selected part back, base64 encoded, and answers with the
 * area the client was located in. Nothing is retried here.
 */
@Log4j2
@RequiredArgsConstructor
public class RadikoAuthenticator {
    static final String AUTH_KEY = "bcd151073c03b352e1ef2fd66c32209da9ca0afa";

    public static final String HEADER_AUTH_TOKEN = "X-Radiko-AuthToken";
    static final String HEADER_APP = "X-Radiko-App";
    static final String HEADER_APP_VERSION = "X-Radiko-App-Version";
    static final String HEADER_DEVICE = "X-Radiko-Device";
    static final String HEADER_USER = "X-Radiko-User";
    static final String HEADER_KEY_OFFSET = "X-Radiko-KeyOffset";
    static final String HEADER_KEY_LENGTH = "X-Radiko-KeyLength";
    static final String HEADER_PARTIAL_KEY = "X-Radiko-PartialKey";

    private static final String APP = "pc_html5";
    private static final String APP_VERSION = "0.0.1";
    private static final String DEVICE = "pc";
    private static final String USER = "dummy_user";

    @NonNull
    private final MainConfiguration mainConfiguration;

    @NonNull
    private final OkHttpClient httpClient;

    record Challenge(String token, int offset, int length) {
    }

    public AuthSession authorize() throws AuthPhase1FailedException, AuthPhase2FailedException {
        val challenge = requestChallenge();
        val partialKey = partialKey(challenge.offset(), challenge.length());
        val areaId = requestArea(challenge.token(), partialKey);
        log.info("Authorized at radiko, area is {}", areaId);
        return new AuthSession(challenge.token(), areaId);
    }

    Challenge requestChallenge() throws AuthPhase1FailedException {
        val request = HttpUtils.enhanceRequest(mainConfiguration, new Request.Builder())
            .url(mainConfiguration.radikoBaseUrl() + "/v2/api/auth1")
            .header(HEADER_APP, APP)
            .header(HEADER_APP_VERSION, APP_VERSION)
            .header(HEADER_DEVICE, DEVICE)
            .header(HEADER_USER, USER)
            .get()
            .build();
        try (val response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new AuthPhase1FailedException("auth1 answered with status " + response.code());
            }
            val token = response.header(HEADER_AUTH_TOKEN);
            if (null == token || token.isBlank()) {
                throw new AuthPhase1FailedException("auth1 did not hand out a token");
            }
            val offset = parseNumber(response.header(HEADER_KEY_OFFSET), HEADER_KEY_OFFSET);
            val length = parseNumber(response.header(HEADER_KEY_LENGTH), HEADER_KEY_LENGTH);
            if (length <= 0) {
                throw new AuthPhase1FailedException("auth1 handed out key length " + length);
            }
            log.debug("auth1 handed out offset {} and length {}", offset, length);
            return new Challenge(token, offset, length);
        } catch (AuthPhase1FailedException e) {
            throw e;
        } catch (IOException e) {
            throw new AuthPhase1FailedException("auth1 request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Base64 of {@code AUTH_KEY[offset, offset + length)}.
     */
    static String partialKey(int offset, int length) throws AuthPhase1FailedException {
        if (offset < 0 || length <= 0 || offset + length > AUTH_KEY.length()) {
            throw new AuthPhase1FailedException(
                "Key offset " + offset + " and length " + length + " lie outside the key");
        }
        val part = AUTH_KEY.substring(offset, offset + length);
        return Base64.getEncoder().encodeToString(part.getBytes(StandardCharsets.US_ASCII));
    }

    String requestArea(String token, String partialKey) throws AuthPhase2FailedException {
        val request = HttpUtils.enhanceRequest(mainConfiguration, new Request.Builder())
            .url(mainConfiguration.radikoBaseUrl() + "/v2/api/auth2")
            .header(HEADER_AUTH_TOKEN, token)
            .header(HEADER_DEVICE, DEVICE)
            .header(HEADER_USER, USER)
            .header(HEADER_PARTIAL_KEY, partialKey)
            .get()
            .build();
        try (val response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new AuthPhase2FailedException("auth2 answered with status " + response.code());
            }
            val body = null == response.body() ? "" : response.body().string().trim();
            val areaId = body.split(",", -1)[0].trim();
            if (areaId.isEmpty()) {
                throw new AuthPhase2FailedException("auth2 answered with an empty body");
            }
            return areaId;
        } catch (AuthPhase2FailedException e) {
            throw e;
        } catch (IOException e) {
            throw new AuthPhase2FailedException("auth2 request failed: " + e.getMessage(), e);
        }
    }

    private static int parseNumber(String value, String headerName) throws AuthPhase1FailedException {
        if (null == value || value.isBlank()) {
            throw new AuthPhase1FailedException("auth1 did not hand out " + headerName);
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new AuthPhase1FailedException("auth1 handed out non-numeric " + headerName + ": " + value, e);
        }
    }
}
