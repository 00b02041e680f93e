package org.worksindex.service.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.worksindex.models.dto.WorksChangeset;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

@Slf4j
@Component
public class ChangesetExporter {

    private final ObjectMapper objectMapper;
    private final Path exportDirectory;

    public ChangesetExporter(ObjectMapper objectMapper,
                             @Value("${works-index.export.path:}") String exportPath) {
        this.objectMapper = objectMapper;
        this.exportDirectory = StringUtils.hasText(exportPath)
                ? Paths.get(exportPath).toAbsolutePath().normalize()
                : null;
    }

    public Optional<Path> export(WorksChangeset changeset) {
        if (exportDirectory == null) {
            return Optional.empty();
        }
        Path target = exportDirectory.resolve("works-changeset-" + changeset.runDate() + ".json");
        Path temporary = exportDirectory.resolve(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(exportDirectory);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temporary.toFile(), changeset);
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException exception) {
            throw new IllegalStateException("Failed to export changeset for run " + changeset.runDate()
                    + " to " + target, exception);
        }
        log.info("[export] Wrote {} works for run {} to {}", changeset.works().size(), changeset.runDate(), target);
        return Optional.of(target);
    }
}
