package com.chessvision.server.util;

import com.chessvision.server.config.VisionConfig;

import java.io.File;

public class DataPathResolver {

    public static final String DATA_DIR_PROPERTY = "chessvision.data.dir";

    public static String resolveDataDirectory(VisionConfig config) {
        // 1. System property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Config file
        if (config != null && config.dataDirectory != null && !config.dataDirectory.isEmpty()) {
            return config.dataDirectory;
        }

        // 3. Default
        return ".";
    }

    public static String resolveFeedbackLog(VisionConfig config) {
        return resolveDataDirectory(config) + File.separator + config.feedback.logFileOrDefault();
    }

    public static String resolveDbPath(VisionConfig config) {
        return resolveDataDirectory(config) + File.separator + config.prototypes.dbFileOrDefault();
    }
}
