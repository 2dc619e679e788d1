package com.eventfullyengineered.jstreamwake.streams;

import com.google.common.collect.ImmutableMap;
import io.reactivex.Observable;
import io.reactivex.Observer;
import io.reactivex.Scheduler;
import io.reactivex.disposables.Disposable;
import io.reactivex.schedulers.Schedulers;
import io.reactivex.subjects.PublishSubject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * An implementation of {@link StreamStoreNotifier} for storages that cannot push append notifications.
 * Polls the tails of all streams and raises an event for every stream that appeared, advanced or disappeared
 * since the previous poll.
 */
public class PollingStreamStoreNotifier implements StreamStoreNotifier, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(PollingStreamStoreNotifier.class);

    private final Supplier<Map<String, String>> readTails;
    private final PublishSubject<StreamEvent> streamsChanged = PublishSubject.create();
    private final Disposable polling;
    private Map<String, String> previousTails = ImmutableMap.of();

    /**
     * Initializes a new instance of {@link PollingStreamStoreNotifier} with a default interval to poll of 1000 milliseconds
     * @see #PollingStreamStoreNotifier(Supplier, long, Scheduler)
     * @param storage The storage to poll
     */
    public PollingStreamStoreNotifier(StreamStorage storage) {
        this(() -> readTails(storage), 1000, Schedulers.newThread());
    }

    /**
     * Initializes a new instance of {@link PollingStreamStoreNotifier}
     * @param readTails An operation reading the tail of every stream, keyed by path
     * @param interval The interval to poll in milliseconds
     * @param scheduler the Scheduler to use for scheduling the polls
     */
    public PollingStreamStoreNotifier(Supplier<Map<String, String>> readTails, long interval, Scheduler scheduler) {
        this.readTails = readTails;
        // Streams existing before the notifier started are not reported
        this.previousTails = initialTails();
        this.polling = Observable.interval(interval, TimeUnit.MILLISECONDS, scheduler)
            .subscribe(tick -> poll());
    }

    public static Map<String, String> readTails(StreamStorage storage) {
        Map<String, String> tails = new HashMap<>();
        for (String path : storage.streamPaths()) {
            tails.put(path, storage.currentTail(path));
        }
        return tails;
    }

    private Map<String, String> initialTails() {
        try {
            return ImmutableMap.copyOf(readTails.get());
        } catch (Exception ex) {
            LOG.error("Exception occurred reading initial tails. All streams will be reported as created.", ex);
            return ImmutableMap.of();
        }
    }

    @Override
    public void subscribe(Observer<? super StreamEvent> observer) {
        streamsChanged.subscribe(observer);
    }

    private void poll() {
        Map<String, String> tails;
        try {
            tails = readTails.get();
            LOG.trace("Polled tails of {} streams. Previous {}", tails.size(), previousTails.size());
        } catch (Exception ex) {
            LOG.error("Exception occurred polling stream storage for tails.", ex);
            return;
        }

        for (Map.Entry<String, String> entry : tails.entrySet()) {
            String previous = previousTails.get(entry.getKey());
            if (previous == null) {
                streamsChanged.onNext(StreamEvent.created(entry.getKey(), Offsets.BEFORE_BEGINNING));
                if (!Offsets.BEFORE_BEGINNING.equals(entry.getValue())) {
                    streamsChanged.onNext(StreamEvent.appended(entry.getKey(), entry.getValue()));
                }
            } else if (!previous.equals(entry.getValue())) {
                streamsChanged.onNext(StreamEvent.appended(entry.getKey(), entry.getValue()));
            }
        }
        for (String path : previousTails.keySet()) {
            if (!tails.containsKey(path)) {
                streamsChanged.onNext(StreamEvent.deleted(path));
            }
        }
        previousTails = ImmutableMap.copyOf(tails);
    }

    @Override
    public void close() {
        polling.dispose();
        streamsChanged.onComplete();
    }

}
