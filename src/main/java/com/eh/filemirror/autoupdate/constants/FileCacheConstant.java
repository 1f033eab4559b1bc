package com.eh.filemirror.autoupdate.constants;

public class FileCacheConstant {

    private FileCacheConstant() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    public static final String FILE_CACHE_TOP_DIR_NAME = "file-cache";

    public static final String FILE_CACHE_TEMP_TOP_DIR_NAME = "file-cache-tmp";

    public static final String FILE_CACHE_DB_FILE_NAME = "file-cache.db";

    public static final String UPLOAD_SUCCESS = "Upload Success";

    public static final String UPLOAD_FAILURE = "Upload Failure";

    public static final long DEFAULT_RECHECK_DELAY_MILLIS = 5000L;

    public static final long DEFAULT_OPENED_FILE_WINDOW_MILLIS = 10_000L;

}
