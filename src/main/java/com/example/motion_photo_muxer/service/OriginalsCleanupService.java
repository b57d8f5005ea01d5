package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.model.FileActionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Third pass: deletes originals, scoped strictly to what the ledger recorded. Files that failed
 * conversion are never deleted here.
 */
@Service
public class OriginalsCleanupService {
    private static final Logger LOGGER = LoggerFactory.getLogger(OriginalsCleanupService.class);

    /** Deletes every still and video that went into a container. */
    public FileActionReport deletePaired(RunLedger ledger) {
        return deleteAll(ledger.paired(), "paired");
    }

    /** Deletes convertible originals whose converted JPEG found no video; the JPEG stays. */
    public FileActionReport deleteConvertedUnmatched(RunLedger ledger) {
        return deleteAll(ledger.convertedUnmatched(), "convertedUnmatched");
    }

    private FileActionReport deleteAll(Collection<Path> paths, String label) {
        int deleted = 0;
        int failed = 0;
        for (Path path : paths) {
            if (!Files.exists(path)) {
                LOGGER.debug("Cleanup skip missing {} path={}", label, path);
                continue;
            }
            if (safeDelete(path)) {
                deleted++;
            } else {
                failed++;
            }
        }
        LOGGER.info("Cleanup {} deleted={} failed={}", label, deleted, failed);
        return new FileActionReport(deleted, failed);
    }

    private boolean safeDelete(Path path) {
        try {
            Files.deleteIfExists(path);
            LOGGER.info("Deleted original path={}", path);
            return true;
        } catch (Exception e) {
            LOGGER.warn("Cleanup delete failed path={} err={}", path, e.toString());
            return false;
        }
    }
}
