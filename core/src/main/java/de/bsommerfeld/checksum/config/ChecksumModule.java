package de.bsommerfeld.checksum.config;

import com.google.inject.AbstractModule;
import de.bsommerfeld.checksum.event.ScanEventBus;
import de.bsommerfeld.checksum.scan.ChecksumScanner;
import de.bsommerfeld.checksum.walk.DirectoryWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice module wiring the scanner and its collaborators.
 */
public class ChecksumModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ChecksumModule.class);

    private final ScannerConfig config;

    public ChecksumModule() {
        this(ScannerConfig.load());
    }

    public ChecksumModule(ScannerConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        LOG.info("Scanner configured: base={}, type={}, match='{}', exclude='{}', recurse={}",
                config.getBasePath(), config.getChecksumType(), config.getMatchGlob(),
                config.getExcludeGlob(), config.isRecurse());

        bind(ScannerConfig.class).toInstance(config);
        bind(DirectoryWalker.class).asEagerSingleton();
        bind(ScanEventBus.class).asEagerSingleton();
        bind(ChecksumScanner.class);
    }
}
