package com.inboxflow.service.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.exception.ProviderRejectionException;
import com.inboxflow.exception.TransientInfraException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Provider send call: POST {base-url}/{api-version}/{phoneNumberId}/messages.
 *
 * Returns the provider message id (messages[0].id). Error responses become a
 * {@link ProviderRejectionException}; connection problems and timeouts become a
 * {@link TransientInfraException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WhatsAppCloudClient {

    private final RestTemplate restTemplate;
    private final ProviderErrorClassifier errorClassifier;
    private final InboxflowProperties properties;

    public String send(String phoneNumberId, String accessToken, Map<String, Object> payload) {
        InboxflowProperties.Dispatch dispatch = properties.getDispatch();
        String url = dispatch.getBaseUrl() + "/" + dispatch.getApiVersion() + "/" + phoneNumberId + "/messages";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(accessToken);

        try {
            ResponseEntity<JsonNode> response = restTemplate.postForEntity(url, new HttpEntity<>(payload, headers),
                    JsonNode.class);
            JsonNode body = response.getBody();
            String externalId = body == null ? "" : body.path("messages").path(0).path("id").asText("");
            if (externalId.isBlank()) {
                throw new ProviderRejectionException(ProviderRejectionException.Kind.UNKNOWN,
                        response.getStatusCode().value(), null, "Provider accepted the send but returned no message id");
            }
            return externalId;
        } catch (HttpStatusCodeException e) {
            ProviderRejectionException rejection =
                    errorClassifier.classify(e.getStatusCode().value(), e.getResponseBodyAsString());
            log.warn("Send via {} rejected: kind={}, {}", phoneNumberId, rejection.getKind(), rejection.getMessage());
            throw rejection;
        } catch (ResourceAccessException e) {
            throw new TransientInfraException("Provider unreachable: " + e.getMessage(), e);
        }
    }
}
