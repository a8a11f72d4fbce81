/**
 * SaveFileService.java
 *
 * Lists the save files the file picker offers. The directory and the extension come from the
 * current NavigationSettings and are re-read on every call, so a settings update takes effect the
 * next time a picker opens.
 */
package club.ppmc.keynav.service;

import club.ppmc.keynav.model.NavigationSettings;
import club.ppmc.keynav.model.SaveFileRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SaveFileService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SaveFileService.class);

    private final SettingsService settingsService;

    public SaveFileService(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    /**
     * @return save files in the configured directory, newest first. An absent directory yields an
     *     empty list.
     * @throws IOException if the directory exists but cannot be read.
     */
    public List<SaveFileRecord> listSaveFiles() throws IOException {
        NavigationSettings settings = settingsService.getSettings();
        Path root = resolveRoot(settings);
        if (Files.notExists(root)) {
            LOGGER.info("Saves directory {} does not exist, offering no files.", root);
            return List.of();
        }
        if (!Files.isDirectory(root)) {
            throw new IOException("Saves root is not a directory: " + root);
        }

        String extension = settings.getSavesExtension();
        List<SaveFileRecord> files = new ArrayList<>();
        try (Stream<Path> stream = Files.list(root)) {
            for (Path path : (Iterable<Path>) stream::iterator) {
                String fileName = path.getFileName().toString();
                if (fileName.startsWith(".") || !Files.isRegularFile(path)) {
                    continue;
                }
                if (extension != null && !extension.isBlank() && !FilenameUtils.isExtension(fileName, extension)) {
                    continue;
                }
                BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
                files.add(new SaveFileRecord(
                        fileName,
                        FilenameUtils.getBaseName(fileName),
                        attributes.lastModifiedTime().toInstant(),
                        attributes.size()));
            }
        }
        files.sort(Comparator.comparing(SaveFileRecord::lastModified).reversed()
                .thenComparing(SaveFileRecord::displayName, String.CASE_INSENSITIVE_ORDER));
        LOGGER.debug("Found {} save files in {}.", files.size(), root);
        return files;
    }

    /**
     * Deletes one save file from the configured directory.
     *
     * @throws IOException if the name points outside the saves directory, is not a save file, or
     *     the file cannot be deleted.
     */
    public void delete(SaveFileRecord file) throws IOException {
        NavigationSettings settings = settingsService.getSettings();
        Path root = resolveRoot(settings);
        String fileName = file.fileName();
        if (fileName == null || !fileName.equals(FilenameUtils.getName(fileName))) {
            throw new IOException("Invalid save file name: " + fileName);
        }
        Path target = root.resolve(fileName).normalize();
        if (!target.startsWith(root) || !root.equals(target.getParent())) {
            throw new IOException("Save file is outside the saves directory: " + fileName);
        }
        String extension = settings.getSavesExtension();
        if (extension != null && !extension.isBlank() && !FilenameUtils.isExtension(fileName, extension)) {
            throw new IOException("Not a save file: " + fileName);
        }
        if (!Files.isRegularFile(target)) {
            throw new IOException("Save file not found: " + fileName);
        }
        Files.delete(target);
        LOGGER.info("Deleted save file {}.", target);
    }

    private Path resolveRoot(NavigationSettings settings) {
        String savesRoot = settings.getSavesRoot();
        if (savesRoot == null || savesRoot.isBlank()) {
            savesRoot = "./saves";
        }
        return Paths.get(savesRoot).toAbsolutePath().normalize();
    }
}
