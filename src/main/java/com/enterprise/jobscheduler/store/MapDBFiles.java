package com.enterprise.jobscheduler.store;

import org.mapdb.DB;
import org.mapdb.DBMaker;

import java.io.File;

/**
 * Opens the transactional MapDB file databases used by the stores
 */
public final class MapDBFiles {

    private MapDBFiles() {
    }

    /**
     * Open or create a file database with transactions enabled
     *
     * @param dbPath      database file
     * @param mmapEnabled use memory-mapped files where the platform supports them
     */
    public static DB open(String dbPath, boolean mmapEnabled) {
        File file = new File(dbPath);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IllegalStateException("Cannot create database directory: " + parent);
        }

        DBMaker.Maker maker = DBMaker.fileDB(file);
        if (mmapEnabled) {
            maker = maker
                .fileMmapEnableIfSupported()
                .fileMmapPreclearDisable();
        }
        return maker
            .allocateStartSize(4 * 1024 * 1024)  // 4MB
            .allocateIncrement(4 * 1024 * 1024)  // 4MB
            .transactionEnable()
            .checksumHeaderBypass()
            .closeOnJvmShutdown()
            .make();
    }
}
