package org.carball.futureyou.config;

import lombok.Data;

import java.nio.file.Path;
import java.nio.file.Paths;

@Data
public class FutureYouConfig {
    public static final String DEFAULT_INPUT_FILE = "futureyou_input.json";
    public static final String DEFAULT_OUTPUT_DIRECTORY = "results/outputs";

    private Path inputFile = Paths.get(DEFAULT_INPUT_FILE);
    private Path outputDirectory = Paths.get(DEFAULT_OUTPUT_DIRECTORY);
    private OutputFormat outputFormat = OutputFormat.BOTH;
    private Path configFile;
    private boolean interactive;
    private boolean checkOnly;
    private boolean verbose;
    private ModelSettings modelSettings = ModelSettings.defaults();
}
