package org.scout.core.extract;

import org.scout.core.model.DiscoveredUnit;
import org.scout.core.scan.SourceFile;
import org.scout.core.scan.SourceScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Scans a project and extracts its test map without running any of it.
 */
public class TestDiscovery {
    private static final Logger logger = LoggerFactory.getLogger(TestDiscovery.class);

    private final SourceScanner scanner;
    private final TestExtractor extractor;

    public TestDiscovery(SourceScanner scanner, TestExtractor extractor) {
        this.scanner = scanner;
        this.extractor = extractor;
    }

    public DiscoveryResult discover(Path root) {
        List<DiscoveredUnit> units = new ArrayList<>();
        List<DiscoveryResult.ParseFailure> failures = new ArrayList<>();
        int collected = 0;

        try (Stream<SourceFile> files = scanner.scan(root)) {
            for (SourceFile file : (Iterable<SourceFile>) files::iterator) {
                String unitId = file.unitId();
                ExtractedUnit extracted;
                try {
                    extracted = extractor.extract(file.content());
                } catch (UnitParseException e) {
                    // one broken file must not sink the whole pass
                    logger.warn("Skipping {}: {}", unitId, e.getMessage());
                    failures.add(new DiscoveryResult.ParseFailure(unitId, e.getMessage()));
                    continue;
                }
                if (!extracted.hasTests()) {
                    continue;
                }
                collected += extracted.methodCount();
                units.add(new DiscoveredUnit(unitId, extracted.packageName(), file.content(), extracted.testMethods()));
            }
        }

        logger.info("Discovered {} tests in {} units ({} unparseable)", collected, units.size(), failures.size());
        return new DiscoveryResult(List.copyOf(units), List.copyOf(failures), collected);
    }
}
