package com.eventfullyengineered.jstreamwake.subscriptions;

import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubscriptionRegistryTest {

    private final SubscriptionRegistry registry = new SubscriptionRegistry();

    @Test
    void createShouldGenerateSecret() {
        CreateSubscriptionResult result = registry.create("sub1", "/agents/*", "http://localhost/hook", "agents");

        assertTrue(result.isCreated());
        assertTrue(result.getSubscription().getWebhookSecret().startsWith(WebhookSecrets.PREFIX));
        assertEquals("/agents/*", result.getSubscription().getPattern());
    }

    @Test
    void identicalRepeatShouldReturnExistingRecord() {
        Subscription first = registry.create("sub1", "/agents/*", "http://localhost/hook", null).getSubscription();

        CreateSubscriptionResult repeat = registry.create("sub1", "/agents/%2A", "http://localhost/hook", null);

        assertFalse(repeat.isCreated());
        assertSame(first, repeat.getSubscription());
    }

    @Test
    void differingRepeatShouldConflict() {
        registry.create("sub1", "/agents/*", "http://localhost/hook", null);

        assertThrows(SubscriptionConflictException.class,
            () -> registry.create("sub1", "/agents/*", "http://localhost/other", null));
        assertThrows(SubscriptionConflictException.class,
            () -> registry.create("sub1", "/agents/**", "http://localhost/hook", null));
    }

    @Test
    void secretsShouldDifferPerSubscription() {
        String a = registry.create("a", "/x", "http://localhost/hook", null).getSubscription().getWebhookSecret();
        String b = registry.create("b", "/x", "http://localhost/hook", null).getSubscription().getWebhookSecret();

        assertNotEquals(a, b);
    }

    @Test
    void listByPatternShouldMatchExactPatternOrAll() {
        registry.create("a", "/agents/*", "http://localhost/hook", null);
        registry.create("b", "/agents/*", "http://localhost/hook", null);
        registry.create("c", "/tasks/**", "http://localhost/hook", null);

        assertEquals(2, registry.listByPattern("/agents/*").size());
        assertEquals(1, registry.listByPattern("/tasks/**").size());
        assertEquals(0, registry.listByPattern("/agents").size());
        assertEquals(3, registry.listByPattern("/**").size());
    }

    @Test
    void affectedShouldFollowCreatesAndDeletes() {
        registry.create("a", "/agents/*", "http://localhost/hook", null);
        registry.create("b", "/**", "http://localhost/hook", null);
        assertEquals(ImmutableSet.of("a", "b"), registry.affected("/agents/t1"));

        assertTrue(registry.delete("a"));

        assertEquals(ImmutableSet.of("b"), registry.affected("/agents/t1"));
        assertFalse(registry.get("a").isPresent());
    }

    @Test
    void deleteShouldNotifyListenersBeforeReturning() {
        List<String> events = new ArrayList<>();
        registry.addListener(new SubscriptionListener() {
            @Override
            public void onSubscriptionCreated(Subscription subscription) {
                events.add("created " + subscription.getSubscriptionId());
            }

            @Override
            public void onSubscriptionDeleted(Subscription subscription) {
                events.add("deleted " + subscription.getSubscriptionId());
            }
        });

        registry.create("a", "/x", "http://localhost/hook", null);
        registry.create("a", "/x", "http://localhost/hook", null);
        registry.delete("a");
        registry.delete("a");

        assertEquals(2, events.size());
        assertEquals("created a", events.get(0));
        assertEquals("deleted a", events.get(1));
    }

    @Test
    void whileExistsShouldRunOnlyForExistingSubscription() {
        registry.create("sub1", "/agents/*", "http://localhost/hook", null);

        Optional<String> present = registry.whileExists("sub1", Subscription::getPattern);
        registry.delete("sub1");
        Optional<String> deleted = registry.whileExists("sub1", subscription -> {
            throw new AssertionError("ran for a deleted subscription");
        });

        assertEquals(Optional.of("/agents/*"), present);
        assertFalse(deleted.isPresent());
    }

    @Test
    void deleteShouldWaitForRunningWhileExists() throws InterruptedException {
        registry.create("sub1", "/agents/*", "http://localhost/hook", null);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread worker = new Thread(() -> registry.whileExists("sub1", subscription -> {
            entered.countDown();
            try {
                return release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }));
        worker.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        Thread deleter = new Thread(() -> registry.delete("sub1"));
        deleter.start();
        deleter.join(200);
        assertTrue(deleter.isAlive());
        assertTrue(registry.get("sub1").isPresent());

        release.countDown();
        deleter.join(5_000);
        worker.join(5_000);
        assertFalse(registry.get("sub1").isPresent());
    }
}
