package com.kspec.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published by the file watcher when a tracked spec file changes on disk.
 */
public class FileChangeEvent extends ApplicationEvent {

    public static final String EVENT_NAME = "file_changed";

    private final String ref;
    private final String action;
    private final String projectPath;

    public FileChangeEvent(Object source, String ref, String action, String projectPath) {
        super(source);
        this.ref = ref;
        this.action = action;
        this.projectPath = projectPath;
    }

    /** Path of the file relative to the project's spec directory. */
    public String getRef() {
        return ref;
    }

    public String getAction() {
        return action;
    }

    public String getProjectPath() {
        return projectPath;
    }
}
