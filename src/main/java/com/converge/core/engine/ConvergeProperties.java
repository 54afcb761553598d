package com.converge.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "converge")
public class ConvergeProperties {

    private String projectDir = ".";
    private String sourceDir = "app";
    private Lambda lambda = new Lambda();
    private Aws aws = new Aws();

    public Path projectPath() {
        return Path.of(projectDir).toAbsolutePath().normalize();
    }

    /** Directory zipped into the deployment package, relative to the project unless absolute. */
    public Path sourcePath() {
        return projectPath().resolve(sourceDir);
    }

    /** Directory holding policy files and deployment state. */
    public Path configPath() {
        return projectPath().resolve(".converge");
    }

    public String getProjectDir() { return projectDir; }
    public void setProjectDir(String projectDir) { this.projectDir = projectDir; }
    public String getSourceDir() { return sourceDir; }
    public void setSourceDir(String sourceDir) { this.sourceDir = sourceDir; }
    public Lambda getLambda() { return lambda; }
    public void setLambda(Lambda lambda) { this.lambda = lambda; }
    public Aws getAws() { return aws; }
    public void setAws(Aws aws) { this.aws = aws; }

    public static class Lambda {
        private int defaultTimeout = 60;
        private int defaultMemorySize = 128;

        public int getDefaultTimeout() { return defaultTimeout; }
        public void setDefaultTimeout(int defaultTimeout) { this.defaultTimeout = defaultTimeout; }
        public int getDefaultMemorySize() { return defaultMemorySize; }
        public void setDefaultMemorySize(int defaultMemorySize) { this.defaultMemorySize = defaultMemorySize; }
    }

    public static class Aws {
        private String region = "us-east-1";
        private String profile;

        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }
        public String getProfile() { return profile; }
        public void setProfile(String profile) { this.profile = profile; }
    }
}
