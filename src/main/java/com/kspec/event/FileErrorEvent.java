package com.kspec.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published by the file watcher when a file could not be read or parsed.
 */
public class FileErrorEvent extends ApplicationEvent {

    public static final String EVENT_NAME = "file_error";

    private final String ref;
    private final String error;
    private final String projectPath;

    public FileErrorEvent(Object source, String ref, String error, String projectPath) {
        super(source);
        this.ref = ref;
        this.error = error;
        this.projectPath = projectPath;
    }

    /** Relative path of the failing file, null when the watcher itself failed. */
    public String getRef() {
        return ref;
    }

    public String getError() {
        return error;
    }

    public String getProjectPath() {
        return projectPath;
    }
}
