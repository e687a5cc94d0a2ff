package com.glisk.backend.common.error;

import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Turns whatever an HTTP client threw into the {@link ServiceException} taxonomy.
 * {@code prefix} names the service in the resulting code ({@code GENERATION_}, {@code STORAGE_}, ...).
 */
public final class ServiceErrorMapper {

    private ServiceErrorMapper() {}

    private static final int MIN_429_RETRY_SEC = 2;
    private static final int MAX_RETRY_SEC = 3600;

    public static ServiceException map(String prefix, Throwable e) {
        if (e == null) return new TransientServiceException(prefix + "_FAILED", null);
        if (e instanceof ServiceException se) return se;

        if (isTimeoutThrowable(e)) {
            return new TransientServiceException(prefix + "_TIMEOUT", safeMsg(e), null, e);
        }

        if (e instanceof RestClientResponseException re) {
            int status = re.getStatusCode().value();
            String body = nullSafe(re.getResponseBodyAsString());

            if (isContentPolicyText(body)) {
                return new ContentPolicyException("blocked by provider policy", e);
            }

            Integer retryAfter = parseRetryAfterHeaderSecondsOrNull(re.getResponseHeaders());

            if (status == 401 || status == 403) {
                return new PermanentServiceException(prefix + "_AUTH_FAILED", "auth failed (" + status + ")", e);
            }
            if (status == 429) {
                int sec = retryAfter == null ? MIN_429_RETRY_SEC : Math.max(MIN_429_RETRY_SEC, retryAfter);
                return new TransientServiceException(prefix + "_RATE_LIMITED", "rate limited", clampSec(sec), e);
            }
            if (status == 408) {
                return new TransientServiceException(prefix + "_TIMEOUT", "timeout", retryAfter, e);
            }
            if (re.getStatusCode().is5xxServerError()) {
                return new TransientServiceException(prefix + "_UPSTREAM_5XX", "upstream " + status, retryAfter, e);
            }
            if (re.getStatusCode().is4xxClientError()) {
                return new PermanentServiceException(prefix + "_BAD_REQUEST",
                        "bad request (" + status + "): " + abbreviate(body), e);
            }
            return new TransientServiceException(prefix + "_FAILED", "http " + status, retryAfter, e);
        }

        if (e instanceof ResourceAccessException rae) {
            return new TransientServiceException(prefix + "_NETWORK_ERROR", safeMsg(rae), null, e);
        }

        if (e instanceof RestClientException rce) {
            return new TransientServiceException(prefix + "_CLIENT_ERROR", safeMsg(rce), null, e);
        }

        return new TransientServiceException(prefix + "_FAILED", safeMsg(e), null, e);
    }

    /** keywords the generation provider uses when its safety checker rejects a prompt */
    public static boolean isContentPolicyText(String text) {
        if (text == null || text.isBlank()) return false;
        String lower = text.toLowerCase(Locale.ROOT);
        return lower.contains("nsfw")
                || lower.contains("safety")
                || lower.contains("content policy")
                || lower.contains("inappropriate");
    }

    private static Integer parseRetryAfterHeaderSecondsOrNull(HttpHeaders headers) {
        if (headers == null) return null;
        String ra = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (ra == null || ra.isBlank()) return null;
        try {
            return clampSec(Integer.parseInt(ra.trim()));
        } catch (NumberFormatException ignored) {
            return null; // HTTP-date form is not used by our providers
        }
    }

    private static int clampSec(int v) {
        if (v < 0) v = 0;
        if (v > MAX_RETRY_SEC) v = MAX_RETRY_SEC;
        return v;
    }

    private static boolean isTimeoutThrowable(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException) return true;
            if (c instanceof TimeoutException) return true;
            String cn = c.getClass().getName();
            if ("java.net.http.HttpTimeoutException".equals(cn)) return true;
        }
        return false;
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200);
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }

    private static String nullSafe(String s) {
        return s == null ? "" : s;
    }
}
