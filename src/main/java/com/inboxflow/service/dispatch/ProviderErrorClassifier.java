package com.inboxflow.service.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.exception.ProviderRejectionException;
import com.inboxflow.exception.ProviderRejectionException.Kind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Maps a provider error response onto {@link Kind}.
 *
 * Error body: {"error":{"message":"...","type":"OAuthException","code":190,"error_subcode":463}}
 *
 *   HTTP 401/403, code 190                         → AUTH_INVALID
 *   HTTP 429, codes 4, 80007, 130429, 131048, 131056 → RATE_LIMITED
 *   codes 131026, 131047, 131051                   → UNDELIVERABLE
 *   code 100, other 4xx                            → BAD_PARAMETER
 *   5xx and anything unmapped                      → UNKNOWN
 */
@Component
@RequiredArgsConstructor
public class ProviderErrorClassifier {

    private static final Set<Integer> RATE_LIMIT_CODES = Set.of(4, 80007, 130429, 131048, 131056);
    private static final Set<Integer> UNDELIVERABLE_CODES = Set.of(131026, 131047, 131051);
    private static final int AUTH_CODE = 190;
    private static final int INVALID_PARAMETER_CODE = 100;

    private final ObjectMapper objectMapper;

    public ProviderRejectionException classify(int httpStatus, String responseBody) {
        JsonNode error = readError(responseBody);
        Integer code = error.path("code").isNumber() ? error.path("code").asInt() : null;
        String providerMessage = error.path("message").asText("");

        Kind kind = kindOf(httpStatus, code);
        String message = "Provider rejected send (HTTP " + httpStatus
                + (code == null ? "" : ", code " + code) + ")"
                + (providerMessage.isBlank() ? "" : ": " + providerMessage);
        return new ProviderRejectionException(kind, httpStatus, code, message);
    }

    static Kind kindOf(int httpStatus, Integer code) {
        if (httpStatus == 401 || httpStatus == 403 || Integer.valueOf(AUTH_CODE).equals(code)) {
            return Kind.AUTH_INVALID;
        }
        if (httpStatus == 429 || (code != null && RATE_LIMIT_CODES.contains(code))) {
            return Kind.RATE_LIMITED;
        }
        if (code != null && UNDELIVERABLE_CODES.contains(code)) {
            return Kind.UNDELIVERABLE;
        }
        if (Integer.valueOf(INVALID_PARAMETER_CODE).equals(code) || (httpStatus >= 400 && httpStatus < 500)) {
            return Kind.BAD_PARAMETER;
        }
        return Kind.UNKNOWN;
    }

    private JsonNode readError(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body).path("error");
        } catch (Exception e) {
            return objectMapper.createObjectNode();
        }
    }
}
