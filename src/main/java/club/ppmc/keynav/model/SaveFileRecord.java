package club.ppmc.keynav.model;

import java.time.Instant;

/**
 * A file offered by the file picker.
 *
 * @param fileName     file name with extension, relative to the saves root.
 * @param displayName  file name without extension, used as label and for typeahead.
 * @param lastModified last write time.
 * @param size         size in bytes.
 */
public record SaveFileRecord(String fileName, String displayName, Instant lastModified, long size) {
}
