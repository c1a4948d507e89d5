package dev.relaygate.steering;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import dev.relaygate.config.SteeringProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.Optional;

/**
 * YAML persistence for the steering rule set. Writes go to a sibling temp file
 * that is then moved over the target, so the watcher never sees half a file.
 */
@Component
public class RuleSetFileStore {

    private static final Logger log = LoggerFactory.getLogger(RuleSetFileStore.class);

    private final Path file;
    private final YAMLMapper yaml;

    public RuleSetFileStore(SteeringProperties properties) {
        this.file = properties.rulesFile();
        this.yaml = YAMLMapper.builder(YAMLFactory.builder()
                        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                        .build())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public Path path() {
        return file;
    }

    public boolean exists() {
        return Files.isRegularFile(file);
    }

    public Optional<FileTime> lastModified() {
        try {
            return exists() ? Optional.of(Files.getLastModifiedTime(file)) : Optional.empty();
        } catch (IOException e) {
            log.warn("Cannot stat steering rules file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public RuleSetDocument read() {
        try {
            return yaml.readValue(file.toFile(), RuleSetDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read steering rules from " + file, e);
        }
    }

    public void write(RuleSetDocument document) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            yaml.writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {} steering rules to {}",
                    document.rules() != null ? document.rules().size() : 0, file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write steering rules to " + file, e);
        }
    }
}
