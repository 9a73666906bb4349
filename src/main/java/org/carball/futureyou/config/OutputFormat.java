package org.carball.futureyou.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH;

    public boolean includesJson() {
        return this == JSON || this == BOTH;
    }

    public boolean includesMarkdown() {
        return this == MARKDOWN || this == BOTH;
    }
}
