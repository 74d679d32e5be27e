package com.flagship.invoice_followup.credential;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;

/**
 * Refresh-token grant over HTTP: form-encoded POST with HTTP Basic client authentication.
 */
@Component
@Slf4j
public class HttpOAuthTokenClient implements OAuthTokenClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;

    public HttpOAuthTokenClient(RestClient.Builder restClientBuilder,
                                ObjectMapper objectMapper,
                                @Value("${credential.oauth.token-url:https://oauth.platform.intuit.com/oauth2/v1/tokens/bearer}") String tokenUrl,
                                @Value("${credential.oauth.client-id:}") String clientId,
                                @Value("${credential.oauth.client-secret:}") String clientSecret,
                                @Value("${credential.oauth.timeout:10s}") Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());

        this.restClient = restClientBuilder.requestFactory(requestFactory).build();
        this.objectMapper = objectMapper;
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    @Override
    public TokenPayload refresh(String refreshToken) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);

        try {
            TokenPayload payload = restClient.post()
                .uri(tokenUrl)
                .headers(headers -> headers.setBasicAuth(clientId, clientSecret))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(form)
                .retrieve()
                .body(TokenPayload.class);

            if (payload == null || payload.getAccessToken() == null) {
                throw new OAuthTransportException("Token endpoint returned no access token");
            }
            return payload;

        } catch (RestClientResponseException e) {
            String error = errorCode(e.getResponseBodyAsString());
            if ("invalid_grant".equals(error)) {
                throw new InvalidGrantException("Provider rejected refresh token: " + e.getStatusCode());
            }
            throw new OAuthTransportException("Token endpoint answered " + e.getStatusCode()
                + (error != null ? " (" + error + ")" : ""), e);
        } catch (RestClientException e) {
            throw new OAuthTransportException("Token endpoint call failed: " + e.getMessage(), e);
        }
    }

    private String errorCode(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node.hasNonNull("error") ? node.get("error").asText() : null;
        } catch (Exception e) {
            log.debug("Token endpoint error body is not JSON: {}", e.getMessage());
            return null;
        }
    }
}
