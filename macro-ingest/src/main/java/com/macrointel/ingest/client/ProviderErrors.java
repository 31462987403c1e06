package com.macrointel.ingest.client;

import com.macrointel.ingest.exception.MacroIngestException;
import com.macrointel.ingest.exception.PermanentFetchException;
import com.macrointel.ingest.exception.RateLimitExceededException;
import com.macrointel.ingest.exception.TransientFetchException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

/**
 * Translates RestTemplate failures into the two fetch failure categories.
 */
final class ProviderErrors {

    private ProviderErrors() {
    }

    static MacroIngestException translate(String provider, String seriesId, RestClientException e) {
        String prefix = provider + " " + seriesId + ": ";
        if (e instanceof HttpClientErrorException.TooManyRequests) {
            return new RateLimitExceededException(prefix + "rate limited (429)", e);
        }
        if (e instanceof HttpClientErrorException clientError) {
            return new PermanentFetchException(prefix + "request rejected (" + clientError.getStatusCode().value() + ")", e);
        }
        if (e instanceof HttpServerErrorException serverError) {
            return new TransientFetchException(prefix + "provider error (" + serverError.getStatusCode().value() + ")", e);
        }
        if (e instanceof ResourceAccessException) {
            return new TransientFetchException(prefix + "I/O error: " + e.getMessage(), e);
        }
        return new PermanentFetchException(prefix + "unusable response: " + e.getMessage(), e);
    }

    static Double parseValue(String raw) {
        if (raw == null || raw.isBlank() || raw.equals(".") || raw.equals("-")) return null;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
