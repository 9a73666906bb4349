package org.carball.futureyou.output;

import java.nio.file.Path;

/**
 * Files written for one result. A path is {@code null} when its format was not requested.
 */
public record SavedFiles(Path jsonResult, Path jsonSummary, Path markdownReport) {}
