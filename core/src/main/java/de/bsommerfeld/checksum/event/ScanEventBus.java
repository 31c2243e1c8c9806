package de.bsommerfeld.checksum.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Publishes scan progress as {@link ScanEvents} records on a Guava
 * {@link EventBus}. Listeners subscribe to the record types they render, e.g.
 * a console progress line or a manifest writer.
 */
@Singleton
public class ScanEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ScanEventBus.class);
    private final EventBus eventBus;

    public ScanEventBus() {
        this.eventBus = new EventBus("checksum-scan");
    }

    public void fileChecksummed(Path file, String checksum) {
        eventBus.post(new ScanEvents.FileChecksummedEvent(file, checksum));
    }

    public void checksumFailed(Path file) {
        LOG.debug("No checksum for {}", file);
        eventBus.post(new ScanEvents.ChecksumFailedEvent(file));
    }

    public void scanCompleted(Path basePath, int total, int failed) {
        eventBus.post(new ScanEvents.ScanCompletedEvent(basePath, total, failed));
    }

    public void register(Object listener) {
        LOG.trace("Registering scan listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        eventBus.unregister(listener);
    }
}
