package com.eventfullyengineered.jstreamwake.http;

import com.eventfullyengineered.jstreamwake.StreamWake;
import com.eventfullyengineered.jstreamwake.StreamWakeSettings;
import com.eventfullyengineered.jstreamwake.consumers.ConsumerState;
import com.eventfullyengineered.jstreamwake.delivery.WebhookResponse;
import com.eventfullyengineered.jstreamwake.delivery.WebhookSigner;
import com.eventfullyengineered.jstreamwake.delivery.WebhookTransport;
import com.eventfullyengineered.jstreamwake.streams.InMemoryStreamStorage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reactivex.schedulers.TestScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockServletContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.support.AnnotationConfigWebApplicationContext;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StreamWakeControllersTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String WEBHOOK = "https://agents.example.com/wake";
    private static final String CONSUMER_ID = "sub1:%2Fagents%2Ft1";

    private final TestScheduler scheduler = new TestScheduler();
    private final InMemoryStreamStorage storage = new InMemoryStreamStorage();
    private final List<ReceivedWebhook> received = new CopyOnWriteArrayList<>();
    private final WebhookTransport transport = (url, headers, body, timeout) -> {
        received.add(new ReceivedWebhook(url, body, headers.get(WebhookSigner.SIGNATURE_HEADER)));
        return CompletableFuture.completedFuture(new WebhookResponse(200, ""));
    };
    private StreamWake streamWake;
    private AnnotationConfigWebApplicationContext context;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        streamWake = new StreamWake(storage,
            new StreamWakeSettings.Builder("https://wake.example.com").build(), transport, scheduler);

        context = new AnnotationConfigWebApplicationContext();
        context.setServletContext(new MockServletContext());
        context.register(StreamWakeWebConfiguration.class);
        context.addBeanFactoryPostProcessor(beanFactory -> beanFactory.registerSingleton("streamWake", streamWake));
        context.refresh();
        mvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @AfterEach
    void tearDown() {
        context.close();
        streamWake.close();
    }

    private static MockHttpServletRequestBuilder putSubscription(String pattern, String id, String body) {
        return put(pattern).param(SubscriptionController.SUBSCRIPTION, id)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body);
    }

    private static MockHttpServletRequestBuilder callback(String consumerId, String token, String body) {
        // a URI keeps the consumer id percent-encoded as sent
        MockHttpServletRequestBuilder request = post(URI.create(CallbackController.PREFIX + consumerId))
            .contentType(MediaType.APPLICATION_JSON)
            .content(body);
        if (token != null) {
            request.header(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }
        return request;
    }

    private static JsonNode json(MvcResult result) throws Exception {
        return MAPPER.readTree(result.getResponse().getContentAsString(StandardCharsets.UTF_8));
    }

    private String createSubscription() throws Exception {
        MvcResult result = mvc.perform(putSubscription("/agents/*", "sub1",
                "{\"webhook\":\"" + WEBHOOK + "\",\"description\":\"agents\"}"))
            .andExpect(status().isCreated())
            .andReturn();
        return json(result).path("webhook_secret").asText();
    }

    @Test
    void putShouldCreateSubscription() throws Exception {
        mvc.perform(putSubscription("/agents/*", "sub1",
                "{\"webhook\":\"" + WEBHOOK + "\",\"description\":\"agents\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.subscription_id").value("sub1"))
            .andExpect(jsonPath("$.pattern").value("/agents/*"))
            .andExpect(jsonPath("$.webhook").value(WEBHOOK))
            .andExpect(jsonPath("$.description").value("agents"))
            .andExpect(jsonPath("$.webhook_secret").isString());

        assertTrue(streamWake.getSubscription("sub1").get().getWebhookSecret().startsWith("whsec_"));
    }

    @Test
    void encodedWildcardShouldBeNormalized() throws Exception {
        mvc.perform(put(URI.create("/agents/%2A?subscription=sub1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"webhook\":\"" + WEBHOOK + "\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.pattern").value("/agents/*"));
    }

    @Test
    void repeatedPutShouldReturnExistingSubscription() throws Exception {
        createSubscription();

        mvc.perform(putSubscription("/agents/*", "sub1",
                "{\"webhook\":\"" + WEBHOOK + "\",\"description\":\"agents\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.subscription_id").value("sub1"))
            .andExpect(jsonPath("$.webhook_secret").doesNotExist());
    }

    @Test
    void conflictingPutShouldBeRejected() throws Exception {
        createSubscription();

        mvc.perform(putSubscription("/jobs/*", "sub1", "{\"webhook\":\"" + WEBHOOK + "\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error.code").value("CONFLICT"));
    }

    @Test
    void putWithoutValidWebhookShouldBeRejected() throws Exception {
        mvc.perform(putSubscription("/agents/*", "sub1", "{\"webhook\":\"ftp://files\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
        mvc.perform(putSubscription("/agents/*", "sub1", "{}"))
            .andExpect(status().isBadRequest());
        mvc.perform(putSubscription("/agents/*", "sub1", "{\"webhook\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
        mvc.perform(putSubscription("/agents/*", " ", "{\"webhook\":\"" + WEBHOOK + "\"}"))
            .andExpect(status().isBadRequest());

        assertFalse(streamWake.getSubscription("sub1").isPresent());
    }

    @Test
    void shouldGetListAndDeleteSubscriptions() throws Exception {
        createSubscription();

        mvc.perform(get("/agents/*").param(SubscriptionController.SUBSCRIPTION, "sub1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.subscription_id").value("sub1"))
            .andExpect(jsonPath("$.webhook_secret").doesNotExist());
        mvc.perform(get("/agents/*").param(SubscriptionController.SUBSCRIPTIONS, ""))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.subscriptions.length()").value(1))
            .andExpect(jsonPath("$.subscriptions[0].subscription_id").value("sub1"));
        mvc.perform(get("/**").param(SubscriptionController.SUBSCRIPTIONS, ""))
            .andExpect(jsonPath("$.subscriptions.length()").value(1));
        mvc.perform(get("/jobs/*").param(SubscriptionController.SUBSCRIPTIONS, ""))
            .andExpect(jsonPath("$.subscriptions.length()").value(0));

        mvc.perform(delete("/agents/*").param(SubscriptionController.SUBSCRIPTION, "sub1"))
            .andExpect(status().isNoContent());
        mvc.perform(delete("/agents/*").param(SubscriptionController.SUBSCRIPTION, "sub1"))
            .andExpect(status().isNoContent());
        mvc.perform(get("/agents/*").param(SubscriptionController.SUBSCRIPTION, "sub1"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void unmappedRequestsShouldBeRejected() throws Exception {
        mvc.perform(post("/agents/*").param(SubscriptionController.SUBSCRIPTIONS, ""))
            .andExpect(status().isMethodNotAllowed());
        mvc.perform(get("/agents/t1"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void callbackWithoutTokenShouldBeUnauthorized() throws Exception {
        mvc.perform(callback(CONSUMER_ID, null, "{\"epoch\":1}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.ok").value(false))
            .andExpect(jsonPath("$.error.code").value("TOKEN_INVALID"));
    }

    @Test
    void malformedCallbackShouldBeBadRequest() throws Exception {
        mvc.perform(callback(CONSUMER_ID, "token", "{\"epoch\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
    }

    @Test
    void callbackForUnknownConsumerShouldBeGone() throws Exception {
        mvc.perform(callback("sub1:%2Fagents%2Fnone", "token", "{\"epoch\":1}"))
            .andExpect(status().isGone())
            .andExpect(jsonPath("$.error.code").value("CONSUMER_GONE"));
    }

    @Test
    void shouldWakeWebhookAndAcceptCallback() throws Exception {
        String secret = createSubscription();

        storage.append("/agents/t1", "hello");
        scheduler.triggerActions();

        assertEquals(1, received.size());
        ReceivedWebhook webhook = received.get(0);
        assertEquals(WEBHOOK, webhook.url);
        assertTrue(WebhookSigner.verify(secret, webhook.body, webhook.signature));
        JsonNode wake = MAPPER.readTree(webhook.body);
        String consumerId = wake.path("consumer_id").asText();
        assertEquals(CONSUMER_ID, consumerId);
        assertEquals(1L, wake.path("epoch").asLong());
        assertEquals("https://wake.example.com/callback/" + consumerId, wake.path("callback").asText());

        mvc.perform(callback(consumerId, wake.path("token").asText(),
                "{\"epoch\":1,\"wake_id\":\"" + wake.path("wake_id").asText() + "\","
                    + "\"acks\":[{\"path\":\"/agents/t1\",\"offset\":\"0\"}],\"done\":true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ok").value(true))
            .andExpect(jsonPath("$.streams[0].path").value("/agents/t1"))
            .andExpect(jsonPath("$.streams[0].offset").value("0"));

        assertEquals(ConsumerState.IDLE, streamWake.getConsumer(consumerId).get().getState());
    }

    private static final class ReceivedWebhook {
        private final String url;
        private final String body;
        private final String signature;

        ReceivedWebhook(String url, String body, String signature) {
            this.url = url;
            this.body = body;
            this.signature = signature;
        }
    }
}
