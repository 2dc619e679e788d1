package com.eventfullyengineered.jstreamwake.streams;

import com.eventfullyengineered.jstreamwake.infrastructure.Ensure;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.reactivex.Observer;
import io.reactivex.subjects.PublishSubject;
import io.reactivex.subjects.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A {@link StreamStorage} holding streams in memory. Offsets are decimal sequence numbers starting at "0".
 * Events are raised synchronously on the thread performing the change.
 */
public class InMemoryStreamStorage implements StreamStorage, StreamStoreNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryStreamStorage.class);

    private final ConcurrentMap<String, List<String>> streams = new ConcurrentHashMap<>();
    private final Subject<StreamEvent> events = PublishSubject.<StreamEvent>create().toSerialized();

    /**
     * Creates an empty stream. Creating an existing stream is a no-op.
     * @param path The stream path
     * @return true if the stream was created
     */
    public boolean createStream(String path) {
        Ensure.streamPath(path, "path");
        boolean created = streams.putIfAbsent(path, new ArrayList<>()) == null;
        if (created) {
            LOG.debug("Stream {} created.", path);
            events.onNext(StreamEvent.created(path, Offsets.BEFORE_BEGINNING));
        }
        return created;
    }

    /**
     * Appends items to a stream, creating it if needed.
     * @return the new tail
     */
    public String append(String path, String... items) {
        Ensure.streamPath(path, "path");
        Preconditions.checkArgument(items != null && items.length > 0, "items must not be null or empty");

        createStream(path);
        String tail;
        List<String> stream = streams.get(path);
        if (stream == null) {
            throw new IllegalStateException("Stream " + path + " was deleted during append");
        }
        synchronized (stream) {
            for (String item : items) {
                stream.add(item);
            }
            tail = String.valueOf(stream.size() - 1);
        }
        LOG.debug("Appended {} items to {}. Tail {}", items.length, path, tail);
        events.onNext(StreamEvent.appended(path, tail));
        return tail;
    }

    /**
     * Deletes a stream.
     * @return true if the stream existed
     */
    public boolean deleteStream(String path) {
        boolean deleted = streams.remove(path) != null;
        if (deleted) {
            LOG.debug("Stream {} deleted.", path);
            events.onNext(StreamEvent.deleted(path));
        }
        return deleted;
    }

    public List<String> read(String path) {
        List<String> stream = streams.get(path);
        if (stream == null) {
            return ImmutableList.of();
        }
        synchronized (stream) {
            return ImmutableList.copyOf(stream);
        }
    }

    @Override
    public String currentTail(String path) {
        List<String> stream = streams.get(path);
        if (stream == null) {
            return Offsets.BEFORE_BEGINNING;
        }
        synchronized (stream) {
            return String.valueOf(stream.size() - 1);
        }
    }

    @Override
    public Iterable<String> streamPaths() {
        return ImmutableList.copyOf(streams.keySet());
    }

    @Override
    public StreamStoreNotifier notifier() {
        return this;
    }

    @Override
    public void subscribe(Observer<? super StreamEvent> observer) {
        events.subscribe(observer);
    }
}
