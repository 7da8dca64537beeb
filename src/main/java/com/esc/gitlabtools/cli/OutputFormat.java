package com.esc.gitlabtools.cli;

public enum OutputFormat {
    TEXT,
    JSON
}
