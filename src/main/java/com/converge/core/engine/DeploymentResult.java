package com.converge.core.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a successful deployment.
 *
 * @param resources  recorded resource values
 * @param recordFile file the values were persisted to
 * @param apiCalls   number of cloud API calls the plan made
 */
public record DeploymentResult(String stage, List<Map<String, Object>> resources, Path recordFile, int apiCalls) {
}
