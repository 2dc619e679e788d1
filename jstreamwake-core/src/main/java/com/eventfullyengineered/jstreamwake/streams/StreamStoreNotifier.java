package com.eventfullyengineered.jstreamwake.streams;

import io.reactivex.ObservableSource;

/**
 * Represents a notifier that lets subscribers know a stream was created, appended to or deleted.
 */
// TODO: move to Flowable once a storage needs back-pressure on append notifications
public interface StreamStoreNotifier extends ObservableSource<StreamEvent> {

}
