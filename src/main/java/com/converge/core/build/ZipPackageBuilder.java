package com.converge.core.build;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Zips a source directory into {@code <outputDir>/<sha256>.zip}.
 * <p>
 * Entries are written in sorted order with a fixed timestamp so that the same
 * sources always produce the same bytes, and so the same digest the deployed
 * function reports.
 */
public class ZipPackageBuilder implements PackageBuilder {

    private static final Logger log = LoggerFactory.getLogger(ZipPackageBuilder.class);
    private static final long FIXED_ENTRY_TIME = 315532800000L; // 1980-01-01T00:00:00Z

    private final Path sourceDir;
    private final Path outputDir;
    private Path built;

    public ZipPackageBuilder(Path sourceDir, Path outputDir) {
        this.sourceDir = sourceDir;
        this.outputDir = outputDir;
    }

    @Override
    public synchronized Path createDeploymentPackage() {
        if (built != null) {
            return built;
        }
        if (!Files.isDirectory(sourceDir)) {
            throw new BuildException("Source directory does not exist: " + sourceDir);
        }
        try {
            Files.createDirectories(outputDir);
            Path tmp = Files.createTempFile(outputDir, "package-", ".zip.tmp");
            writeZip(tmp);
            Path target = outputDir.resolve(PackageDigest.sha256Hex(tmp) + ".zip");
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Built deployment package {}", target);
            built = target;
            return target;
        } catch (IOException e) {
            throw new BuildException("Unable to build deployment package from " + sourceDir, e);
        }
    }

    private void writeZip(Path target) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(sourceDir)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> !p.startsWith(outputDir))
                    .sorted()
                    .collect(Collectors.toList());
        }
        try (OutputStream out = Files.newOutputStream(target);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Path file : files) {
                String name = sourceDir.relativize(file).toString().replace('\\', '/');
                ZipEntry entry = new ZipEntry(name);
                entry.setTime(FIXED_ENTRY_TIME);
                zip.putNextEntry(entry);
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }
    }
}
