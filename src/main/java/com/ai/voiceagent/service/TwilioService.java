package com.ai.voiceagent.service;

import com.ai.voiceagent.exception.TelephonyException;
import com.twilio.exception.TwilioException;
import com.twilio.http.HttpMethod;
import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Call;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URI;

/**
 * Outbound call origination through the Twilio REST API.
 */
@Service
public class TwilioService {

    private static final Logger log = LoggerFactory.getLogger(TwilioService.class);

    @Value("${twilio.account-sid:${TWILIO_ACCOUNT_SID:}}")
    private String accountSid;

    @Value("${twilio.auth-token:${TWILIO_AUTH_TOKEN:}}")
    private String authToken;

    @Value("${twilio.phone-number:${TWILIO_PHONE_NUMBER:}}")
    private String phoneNumber;

    @Value("${twilio.base-url:}")
    private String baseUrl;

    private TwilioRestClient client;

    @PostConstruct
    void init() {
        if (!hasCredentials()) {
            log.warn("Twilio credentials not set; outbound calling disabled");
            return;
        }
        try {
            client = new TwilioRestClient.Builder(accountSid.trim(), authToken.trim()).build();
            log.info("Twilio client initialized | from={}", phoneNumber);
        } catch (RuntimeException e) {
            log.error("Twilio client init failed", e);
            client = null;
        }
    }

    public boolean isConfigured() {
        return client != null && StringUtils.isNotBlank(phoneNumber);
    }

    public String getPhoneNumber() {
        return isConfigured() ? phoneNumber : null;
    }

    public String webhookUrl(String path) {
        String base = StringUtils.isNotBlank(baseUrl) ? StringUtils.removeEnd(baseUrl.trim(), "/") : "";
        return base + path;
    }

    /**
     * Dials {@code toNumber} from the configured origin number. Twilio fetches {@code callbackPath}
     * once the call is answered.
     *
     * @return the new call's SID
     * @throws TelephonyException if Twilio is not configured or rejects the call
     */
    public String placeCall(String toNumber, String callbackPath) {
        if (!isConfigured() || StringUtils.isBlank(baseUrl)) {
            throw TelephonyException.notConfigured();
        }
        try {
            Call call = Call.creator(new PhoneNumber(toNumber), new PhoneNumber(phoneNumber), URI.create(webhookUrl(callbackPath)))
                    .setMethod(HttpMethod.POST)
                    .create(client);
            log.info("Outbound call initiated to {} | callSid={}", toNumber, call.getSid());
            return call.getSid();
        } catch (TwilioException | IllegalArgumentException e) {
            throw new TelephonyException("Outbound call to " + toNumber + " failed", e);
        }
    }

    private boolean hasCredentials() {
        return StringUtils.isNotBlank(accountSid) && StringUtils.isNotBlank(authToken);
    }
}
