package com.projectdesk.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk shape of {@code <projects>/<id>/manifest.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectManifest {

    private String name;

    @JsonProperty("read_dirs")
    private List<String> readDirs = new ArrayList<>();

    @JsonProperty("input_dir")
    private String inputDir = "input";

    @JsonProperty("guideline_dir")
    private String guidelineDir = "guideline";

    @JsonProperty("write_dir")
    private String writeDir = "output";

    @JsonProperty("staging_dir")
    private String stagingDir = "output_pending";

    private Map<String, String> aliases = new LinkedHashMap<>();

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public List<String> getReadDirs() { return readDirs; }
    public void setReadDirs(List<String> readDirs) { this.readDirs = readDirs; }

    public String getInputDir() { return inputDir; }
    public void setInputDir(String inputDir) { this.inputDir = inputDir; }

    public String getGuidelineDir() { return guidelineDir; }
    public void setGuidelineDir(String guidelineDir) { this.guidelineDir = guidelineDir; }

    public String getWriteDir() { return writeDir; }
    public void setWriteDir(String writeDir) { this.writeDir = writeDir; }

    public String getStagingDir() { return stagingDir; }
    public void setStagingDir(String stagingDir) { this.stagingDir = stagingDir; }

    public Map<String, String> getAliases() { return aliases; }
    public void setAliases(Map<String, String> aliases) { this.aliases = aliases; }
}
